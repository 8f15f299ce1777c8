package io.github.eutro.irhtml.core.ir;

import java.util.Locale;

/**
 * Instruction opcodes.
 * <p>
 * Each opcode belongs to a {@link Form}, which decides how its operands are laid out
 * in text. Opcodes within a form only differ in their mnemonic.
 */
public enum Opcode {
    ADD(Form.BINARY),
    SUB(Form.BINARY),
    MUL(Form.BINARY),
    SDIV(Form.BINARY),
    UDIV(Form.BINARY),
    SREM(Form.BINARY),
    UREM(Form.BINARY),
    AND(Form.BINARY),
    OR(Form.BINARY),
    XOR(Form.BINARY),
    SHL(Form.BINARY),
    LSHR(Form.BINARY),
    ASHR(Form.BINARY),
    FADD(Form.BINARY),
    FSUB(Form.BINARY),
    FMUL(Form.BINARY),
    FDIV(Form.BINARY),

    ICMP(Form.COMPARE),
    FCMP(Form.COMPARE),

    TRUNC(Form.CAST),
    ZEXT(Form.CAST),
    SEXT(Form.CAST),
    BITCAST(Form.CAST),
    PTRTOINT(Form.CAST),
    INTTOPTR(Form.CAST),
    SITOFP(Form.CAST),
    FPTOSI(Form.CAST),

    SELECT(Form.SELECT),
    ALLOCA(Form.ALLOCA),
    LOAD(Form.LOAD),
    STORE(Form.STORE),
    GETELEMENTPTR(Form.GETELEMENTPTR),
    CALL(Form.CALL),
    PHI(Form.PHI),
    BR(Form.BRANCH),
    RET(Form.RETURN),
    UNREACHABLE(Form.UNREACHABLE),
    ;

    /**
     * The operand layouts of instructions.
     */
    public enum Form {
        /**
         * {@code op <ty> <lhs>, <rhs>}
         */
        BINARY,
        /**
         * {@code op <pred> <ty> <lhs>, <rhs>}, predicate from {@link io.github.eutro.irhtml.core.ext.CommonExts#PREDICATE}
         */
        COMPARE,
        /**
         * {@code op <ty> <val> to <result ty>}
         */
        CAST,
        /**
         * {@code select i1 <cond>, <ty> <a>, <ty> <b>}
         */
        SELECT,
        /**
         * {@code alloca <ty>[, <ty> <count>]}, type from {@link io.github.eutro.irhtml.core.ext.CommonExts#ALLOCATED_TYPE}
         */
        ALLOCA,
        /**
         * {@code load <ty>, ptr <ptr>}
         */
        LOAD,
        /**
         * {@code store <ty> <val>, ptr <ptr>}
         */
        STORE,
        /**
         * {@code getelementptr <ty>, ptr <base>, <ty> <idx>...}, type from
         * {@link io.github.eutro.irhtml.core.ext.CommonExts#SOURCE_ELEMENT_TYPE}
         */
        GETELEMENTPTR,
        /**
         * {@code call <ret> <callee>(<ty> <arg>, ...)}, callee is operand zero
         */
        CALL,
        /**
         * {@code phi <ty> [ <val>, <block> ], ...}, operands in value/block pairs
         */
        PHI,
        /**
         * {@code br label <dest>} or {@code br i1 <cond>, label <then>, label <else>}
         */
        BRANCH,
        /**
         * {@code ret void} or {@code ret <ty> <val>}
         */
        RETURN,
        UNREACHABLE,
        ;
    }

    public final Form form;
    public final String mnemonic = name().toLowerCase(Locale.ROOT);

    Opcode(Form form) {
        this.form = form;
    }

    /**
     * Whether instructions with this opcode end a basic block.
     *
     * @return Whether this is a terminator.
     */
    public boolean isTerminator() {
        return form == Form.BRANCH || form == Form.RETURN || form == Form.UNREACHABLE;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
