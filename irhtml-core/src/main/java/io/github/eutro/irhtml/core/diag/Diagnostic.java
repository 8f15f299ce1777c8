package io.github.eutro.irhtml.core.diag;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A problem that was recovered from during a render.
 */
public final class Diagnostic {
    public final DiagnosticKind kind;
    public final String message;
    /**
     * A short description of the node the problem was found at, or the stream for merge problems.
     */
    public final String subject;

    public Diagnostic(@NotNull DiagnosticKind kind, @NotNull String message, @NotNull String subject) {
        this.kind = Objects.requireNonNull(kind);
        this.message = Objects.requireNonNull(message);
        this.subject = Objects.requireNonNull(subject);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && message.equals(that.message) && subject.equals(that.subject);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, subject);
    }

    @Override
    public String toString() {
        return kind + ": " + message + " (at " + subject + ")";
    }
}
