package io.github.eutro.irhtml.core.diag;

/**
 * The recoverable problems a render can run into.
 */
public enum DiagnosticKind {
    /**
     * A node is missing an operand, a type, or some other part it should have.
     */
    MALFORMED_NODE,
    /**
     * An operand refers to a value that can be neither named nor numbered where it is used.
     */
    UNRESOLVED_REFERENCE,
    /**
     * The styling marker was not found exactly once when merging.
     */
    MERGE_MARKER_MISMATCH,
}
