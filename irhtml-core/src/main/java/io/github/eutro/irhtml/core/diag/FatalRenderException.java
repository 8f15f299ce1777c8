package io.github.eutro.irhtml.core.diag;

/**
 * Thrown when a render cannot be completed at all, such as when the output buffers
 * cannot be grown. Problems with the graph itself never cause this; they are reported
 * as {@link Diagnostic}s instead.
 */
public class FatalRenderException extends RuntimeException {
    public FatalRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
