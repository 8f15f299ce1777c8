package io.github.eutro.irhtml.core.diag;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The diagnostics collected over one render, in the order they were reported.
 */
public final class Diagnostics {
    private final List<Diagnostic> list = new ArrayList<>();

    public void report(@NotNull DiagnosticKind kind, @NotNull String message, @NotNull String subject) {
        list.add(new Diagnostic(kind, message, subject));
    }

    public List<Diagnostic> getAll() {
        return Collections.unmodifiableList(list);
    }

    public int count(DiagnosticKind kind) {
        int n = 0;
        for (Diagnostic diagnostic : list) {
            if (diagnostic.kind == kind) n++;
        }
        return n;
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    public int size() {
        return list.size();
    }
}
