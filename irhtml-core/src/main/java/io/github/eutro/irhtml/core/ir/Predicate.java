package io.github.eutro.irhtml.core.ir;

import java.util.Locale;

/**
 * Comparison predicates of {@link Opcode#ICMP} and {@link Opcode#FCMP}.
 */
public enum Predicate {
    EQ, NE,
    UGT, UGE, ULT, ULE,
    SGT, SGE, SLT, SLE,
    OEQ, ONE, OGT, OGE, OLT, OLE,
    UEQ, UNE, ORD, UNO,
    ;

    public final String mnemonic = name().toLowerCase(Locale.ROOT);

    @Override
    public String toString() {
        return mnemonic;
    }
}
