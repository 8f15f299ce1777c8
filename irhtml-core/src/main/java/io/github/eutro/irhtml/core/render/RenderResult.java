package io.github.eutro.irhtml.core.render;

import io.github.eutro.irhtml.core.diag.Diagnostic;
import io.github.eutro.irhtml.core.diag.DiagnosticKind;

import java.util.List;

/**
 * The output of one render.
 */
public final class RenderResult {
    /**
     * The content stream, with the styling marker still in place.
     */
    public final String content;
    /**
     * The style stream.
     */
    public final String style;
    /**
     * The content stream with the style stream merged in.
     */
    public final String document;
    public final List<Diagnostic> diagnostics;

    public RenderResult(String content, String style, String document, List<Diagnostic> diagnostics) {
        this.content = content;
        this.style = style;
        this.document = document;
        this.diagnostics = diagnostics;
    }

    public long count(DiagnosticKind kind) {
        return diagnostics.stream().filter(it -> it.kind == kind).count();
    }
}
