package io.github.eutro.irhtml.core.render;

import io.github.eutro.irhtml.core.ext.CommonExts;
import io.github.eutro.irhtml.core.ir.Opcode;
import io.github.eutro.irhtml.core.ir.Predicate;
import io.github.eutro.irhtml.core.ir.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Operand printers for each {@link Opcode.Form}. The opcode mnemonic and any result name
 * have already been written when a printer is called.
 */
final class InsnPrinters {
    interface InsnPrinter {
        void print(Renderer r, Value insn);
    }

    private static final Map<Opcode.Form, InsnPrinter> PRINTERS = new EnumMap<>(Opcode.Form.class);
    private static final Set<Opcode.Form> RESULT_TYPED = EnumSet.of(
            Opcode.Form.BINARY,
            Opcode.Form.CAST,
            Opcode.Form.LOAD,
            Opcode.Form.CALL,
            Opcode.Form.PHI
    );

    static {
        PRINTERS.put(Opcode.Form.BINARY, (r, insn) -> {
            r.out().text(" ");
            r.type(insn, insn.getType(), "type");
            r.out().text(" ");
            r.untypedOperand(insn, 0);
            r.out().text(", ");
            r.untypedOperand(insn, 1);
        });
        PRINTERS.put(Opcode.Form.COMPARE, (r, insn) -> {
            r.out().text(" ");
            Predicate pred = insn.getNullable(CommonExts.PREDICATE);
            if (pred == null) {
                r.malformed(insn, "missing predicate");
                r.placeholder(Renderer.UNKNOWN_PREDICATE);
            } else {
                r.out().span(StyleClass.KEYWORD, pred.mnemonic);
            }
            r.out().text(" ");
            r.typedOperand(insn, 0);
            r.out().text(", ");
            r.untypedOperand(insn, 1);
        });
        PRINTERS.put(Opcode.Form.CAST, (r, insn) -> {
            r.out().text(" ");
            r.typedOperand(insn, 0);
            r.out().text(" ").span(StyleClass.KEYWORD, "to").text(" ");
            r.type(insn, insn.getType(), "type");
        });
        PRINTERS.put(Opcode.Form.SELECT, (r, insn) -> {
            r.out().text(" ");
            r.typedOperand(insn, 0);
            r.out().text(", ");
            r.typedOperand(insn, 1);
            r.out().text(", ");
            r.typedOperand(insn, 2);
        });
        PRINTERS.put(Opcode.Form.ALLOCA, (r, insn) -> {
            r.out().text(" ");
            r.type(insn, insn.getNullable(CommonExts.ALLOCATED_TYPE), "allocated type");
            if (insn.getNumOperands() > 0) {
                r.out().text(", ");
                r.typedOperand(insn, 0);
            }
        });
        PRINTERS.put(Opcode.Form.LOAD, (r, insn) -> {
            r.out().text(" ");
            r.type(insn, insn.getType(), "type");
            r.out().text(", ");
            r.typedOperand(insn, 0);
        });
        PRINTERS.put(Opcode.Form.STORE, (r, insn) -> {
            r.out().text(" ");
            r.typedOperand(insn, 0);
            r.out().text(", ");
            r.typedOperand(insn, 1);
        });
        PRINTERS.put(Opcode.Form.GETELEMENTPTR, (r, insn) -> {
            r.out().text(" ");
            r.type(insn, insn.getNullable(CommonExts.SOURCE_ELEMENT_TYPE), "source element type");
            int n = Math.max(insn.getNumOperands(), 1);
            for (int i = 0; i < n; i++) {
                r.out().text(", ");
                r.typedOperand(insn, i);
            }
        });
        PRINTERS.put(Opcode.Form.CALL, (r, insn) -> {
            r.out().text(" ");
            r.type(insn, insn.getType(), "type");
            r.out().text(" ");
            r.untypedOperand(insn, 0);
            r.out().text("(");
            for (int i = 1; i < insn.getNumOperands(); i++) {
                if (i != 1) r.out().text(", ");
                r.typedOperand(insn, i);
            }
            r.out().text(")");
        });
        PRINTERS.put(Opcode.Form.PHI, (r, insn) -> {
            r.out().text(" ");
            r.type(insn, insn.getType(), "type");
            int n = insn.getNumOperands();
            for (int i = 0; i < n; i += 2) {
                r.out().text(i == 0 ? " [ " : ", [ ");
                r.untypedOperand(insn, i);
                r.out().text(", ");
                r.untypedOperand(insn, i + 1);
                r.out().text(" ]");
            }
        });
        PRINTERS.put(Opcode.Form.BRANCH, (r, insn) -> {
            // unconditional with one operand, conditional with three
            int n = insn.getNumOperands() <= 1 ? 1 : 3;
            for (int i = 0; i < n; i++) {
                r.out().text(i == 0 ? " " : ", ");
                r.typedOperand(insn, i);
            }
        });
        PRINTERS.put(Opcode.Form.RETURN, (r, insn) -> {
            r.out().text(" ");
            if (insn.getNumOperands() == 0) {
                r.out().span(StyleClass.TYPE, "void");
            } else {
                r.typedOperand(insn, 0);
            }
        });
        PRINTERS.put(Opcode.Form.UNREACHABLE, (r, insn) -> {
        });

        for (Opcode.Form form : Opcode.Form.values()) {
            if (!PRINTERS.containsKey(form)) {
                throw new IllegalStateException("No printer for instruction form " + form);
            }
        }
    }

    private InsnPrinters() {
    }

    static InsnPrinter get(Opcode.Form form) {
        return PRINTERS.get(form);
    }

    /**
     * Whether the printer of {@code form} writes the instruction's own type, reporting it if missing.
     */
    static boolean printsResultType(Opcode.Form form) {
        return RESULT_TYPED.contains(form);
    }

    static Set<Opcode.Form> getForms() {
        return Collections.unmodifiableSet(PRINTERS.keySet());
    }
}
