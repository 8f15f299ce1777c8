package io.github.eutro.irhtml.core.ir;

/**
 * The closed set of things a {@link Value} can be.
 */
public enum ValueKind {
    INSTRUCTION(Scope.FUNCTION),
    ARGUMENT(Scope.FUNCTION),
    BASIC_BLOCK(Scope.FUNCTION),
    GLOBAL_VARIABLE(Scope.MODULE),
    FUNCTION(Scope.MODULE),
    /**
     * A metadata tuple. May reference other metadata, including itself.
     */
    METADATA(Scope.METADATA),
    /**
     * A literal, including metadata strings. Constants are never numbered.
     */
    CONSTANT(Scope.NONE),
    ;

    /**
     * Where unnamed values of a kind are numbered, and with which sigil they print.
     */
    public enum Scope {
        FUNCTION('%'),
        MODULE('@'),
        METADATA('!'),
        NONE('\0'),
        ;

        public final char sigil;

        Scope(char sigil) {
            this.sigil = sigil;
        }
    }

    public final Scope scope;

    ValueKind(Scope scope) {
        this.scope = scope;
    }
}
