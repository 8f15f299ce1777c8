package io.github.eutro.irhtml.core.render;

import io.github.eutro.irhtml.core.diag.DiagnosticKind;
import io.github.eutro.irhtml.core.diag.Diagnostics;
import io.github.eutro.irhtml.core.diag.FatalRenderException;
import io.github.eutro.irhtml.core.ext.CommonExts;
import io.github.eutro.irhtml.core.ir.*;
import io.github.eutro.irhtml.core.ir.Module;
import io.github.eutro.irhtml.core.slots.SlotTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders a {@link Module} as an HTML document of its textual form.
 * <p>
 * The module is walked in declaration order: globals, then functions, each block and
 * each instruction in turn, then named and numbered metadata. Unnamed values are numbered
 * by a {@link SlotTracker} as they are encountered.
 * <p>
 * This must cope with whatever it is given, since it is most useful on graphs that some
 * transformation has broken. Anything missing is written as a placeholder and reported
 * as a diagnostic, and the walk carries on.
 */
public final class Renderer {
    private static final Logger logger = LogManager.getLogger(Renderer.class);

    public static final String UNKNOWN_TYPE = "<unknown-type>";
    public static final String NULL_OPERAND = "<null operand!>";
    public static final String MISSING_OPERAND = "<missing operand>";
    public static final String BAD_REF = "<badref>";
    public static final String UNKNOWN_PREDICATE = "<unknown-predicate>";
    public static final String UNKNOWN_OPCODE = "<unknown-opcode>";
    public static final String MISSING_LITERAL = "<missing literal>";

    private final Module module;
    private final RenderOptions options;
    private final @Nullable AnnotationHook hook;
    private final Diagnostics diagnostics;

    private final SlotTracker slots = new SlotTracker();
    private final StyleSheet styles = new StyleSheet();
    private final HtmlWriter out = new HtmlWriter(styles);

    private final Map<Value, Integer> positions = new IdentityHashMap<>();
    private final Map<Value, String> elementIds = new IdentityHashMap<>();
    private final Map<Value, Set<String>> reported = new IdentityHashMap<>();

    private final AnnotationHook.Context context = new AnnotationHook.Context() {
        @Override
        public String nameOf(Value value) {
            return spell(value);
        }

        @Override
        public String typeOf(Value value) {
            Type type = value.getType();
            if (type == null) {
                malformed(value, "missing type");
                return UNKNOWN_TYPE;
            }
            return type.toString();
        }

        @Override
        public List<Use> usesOf(Value value) {
            return orderedUses(value);
        }

        @Override
        public RenderOptions getOptions() {
            return options;
        }
    };

    private Renderer(Module module, RenderOptions options, @Nullable AnnotationHook hook, Diagnostics diagnostics) {
        this.module = module;
        this.options = options;
        this.hook = options.includeAnnotations ? hook : null;
        this.diagnostics = diagnostics;
    }

    /**
     * Render a module.
     *
     * @param module  The module, which must not be modified until this returns.
     * @param options The options.
     * @param hook    The annotation hook, or null for none.
     * @return The content and style streams, the merged document, and any diagnostics.
     * @throws FatalRenderException If the output could not be buffered.
     */
    @Contract(pure = true)
    public static @NotNull RenderResult render(Module module, RenderOptions options, @Nullable AnnotationHook hook) {
        Diagnostics diagnostics = new Diagnostics();
        try {
            Renderer renderer = new Renderer(module, options, hook, diagnostics);
            renderer.renderModule();
            String content = renderer.out.toString();
            String style = renderer.styles.toString();
            String document = StreamMerger.merge(content, style, diagnostics);
            if (!diagnostics.isEmpty()) {
                logger.warn("Rendered {} with {} diagnostic(s)", module.getModuleId(), diagnostics.size());
            }
            return new RenderResult(content, style, document, diagnostics.getAll());
        } catch (OutOfMemoryError | StackOverflowError e) {
            throw new FatalRenderException("could not buffer rendering of " + module.getModuleId(), e);
        }
    }

    // module structure

    private void renderModule() {
        logger.debug("Rendering module {}", module.getModuleId());
        numberPositions();

        String title = options.title == null ? module.getModuleId() : options.title;
        out.raw("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n<title>")
                .text(title)
                .raw("</title>\n")
                .raw(StreamMerger.MARKER)
                .raw("\n</head>\n<body>\n<pre class=\"module\">");

        out.span(StyleClass.COMMENT, "; ModuleID = '" + module.getModuleId() + "'").newline();
        if (module.getSourceFileName() != null) {
            out.span(StyleClass.KEYWORD, "source_filename").text(" = ")
                    .span(StyleClass.CONSTANT, Names.quoted(module.getSourceFileName())).newline();
        }
        if (module.getDataLayout() != null) {
            out.span(StyleClass.KEYWORD, "target datalayout").text(" = ")
                    .span(StyleClass.CONSTANT, Names.quoted(module.getDataLayout())).newline();
        }
        if (module.getTargetTriple() != null) {
            out.span(StyleClass.KEYWORD, "target triple").text(" = ")
                    .span(StyleClass.CONSTANT, Names.quoted(module.getTargetTriple())).newline();
        }

        if (!module.getGlobals().isEmpty()) {
            out.newline();
            for (Value global : module.getGlobals()) {
                renderGlobal(global);
            }
        }

        for (Function function : module.getFunctions()) {
            out.newline();
            renderFunction(function);
        }

        if (options.preserveUseListOrder) {
            List<Value> moduleValues = new ArrayList<>(module.getGlobals());
            for (Function function : module.getFunctions()) {
                moduleValues.add(function.getValue());
            }
            renderUseListOrders(moduleValues, "");
        }

        if (!module.getNamedMetadata().isEmpty()) {
            out.newline();
            for (Map.Entry<String, List<Value>> entry : module.getNamedMetadata().entrySet()) {
                renderNamedMetadata(entry.getKey(), entry.getValue());
            }
        }

        List<Value> numbered = slots.getNumberedMetadata();
        if (!numbered.isEmpty()) {
            out.newline();
            // definitions may number further nodes, which are then defined in turn
            for (int i = 0; i < numbered.size(); i++) {
                renderMetadataDefinition(numbered.get(i));
            }
        }

        out.raw("</pre>\n</body>\n</html>\n");
        logger.debug("Rendered {} function(s) and {} metadata node(s)", module.getFunctions().size(), numbered.size());
    }

    /**
     * Number every global and instruction by where it appears in the module, which
     * gives the default order of use-lists.
     */
    private void numberPositions() {
        for (Value global : module.getGlobals()) {
            positions.put(global, positions.size());
        }
        for (Function function : module.getFunctions()) {
            for (BasicBlock block : function.blocks) {
                for (Value insn : block.getInstructions()) {
                    positions.put(insn, positions.size());
                }
            }
        }
    }

    private void renderGlobal(Value global) {
        define(global);
        out.text(" = ");
        Linkage linkage = global.getExt(CommonExts.LINKAGE).orElse(Linkage.EXTERNAL);
        Value initializer = global.getNumOperands() > 0 ? global.getOperand(0) : null;
        if (global.getNumOperands() == 0 && linkage == Linkage.EXTERNAL) {
            out.span(StyleClass.KEYWORD, "external").text(" ");
        } else if (!linkage.keyword.isEmpty()) {
            out.span(StyleClass.KEYWORD, linkage.keyword).text(" ");
        }
        boolean constant = global.getExt(CommonExts.IS_CONSTANT).orElse(false);
        out.span(StyleClass.KEYWORD, constant ? "constant" : "global").text(" ");
        type(global, global.getNullable(CommonExts.VALUE_TYPE), "value type");
        if (global.getNumOperands() > 0) {
            out.text(" ");
            if (initializer == null) {
                malformed(global, "null initializer");
                placeholder(NULL_OPERAND);
            } else {
                reference(initializer);
            }
        }
        annotate(global);
        out.newline();
    }

    private void renderFunction(Function function) {
        slots.enterFunction(function);
        boolean define = !function.isDeclaration();
        Value fnValue = function.getValue();

        out.span(StyleClass.KEYWORD, define ? "define" : "declare").text(" ");
        if (!function.getLinkage().keyword.isEmpty()) {
            out.span(StyleClass.KEYWORD, function.getLinkage().keyword).text(" ");
        }
        type(fnValue, function.getReturnType(), "return type");
        out.text(" ");
        define(fnValue);
        out.text("(");
        boolean first = true;
        for (Value argument : function.getArguments()) {
            if (!first) out.text(", ");
            first = false;
            type(argument, argument.getType(), "type");
            if (define) {
                out.text(" ");
                define(argument);
            }
        }
        if (function.isVarArgs()) {
            out.text(first ? "..." : ", ...");
        }
        out.text(")");
        if (define) out.text(" {");
        if (hook != null) {
            String annotation = hook.functionAnnotation(function, context);
            if (annotation != null && !annotation.isEmpty()) {
                out.text(" ").span(StyleClass.COMMENT, annotation);
            }
        }
        out.newline();

        if (define) {
            boolean firstBlock = true;
            for (BasicBlock block : function.blocks) {
                if (!firstBlock) out.newline();
                firstBlock = false;
                renderBlock(block);
            }
            if (options.preserveUseListOrder) {
                List<Value> locals = new ArrayList<>(function.getArguments());
                for (BasicBlock block : function.blocks) {
                    locals.addAll(block.getInstructions());
                }
                renderUseListOrders(locals, "  ");
            }
            out.text("}").newline();
        }
        slots.exitFunction();
    }

    private void renderBlock(BasicBlock block) {
        Value label = block.getValue();
        String spelled = label.hasName()
                ? Names.identifier('%', label.getName()).substring(1)
                : Integer.toString(slots.getSlot(label));
        out.anchor(StyleClass.LABEL, elementId(label), spelled).text(":").newline();
        for (Value insn : block.getInstructions()) {
            renderInstruction(insn);
        }
    }

    private void renderInstruction(Value insn) {
        out.text("  ");
        if (insn.hasResult()) {
            define(insn);
            out.text(" = ");
        }
        Opcode opcode = insn.getOpcode();
        if (opcode == null) {
            malformed(insn, "missing opcode");
            placeholder(UNKNOWN_OPCODE);
            for (int i = 0; i < insn.getNumOperands(); i++) {
                out.text(i == 0 ? " " : ", ");
                typedOperand(insn, i);
            }
        } else {
            out.span(StyleClass.OPCODE, opcode.mnemonic);
            InsnPrinters.get(opcode.form).print(this, insn);
        }
        if (insn.getType() == null && (opcode == null || !InsnPrinters.printsResultType(opcode.form))) {
            malformed(insn, "missing type");
            out.text(" ");
            placeholder(UNKNOWN_TYPE);
        }
        annotate(insn);
        out.newline();
    }

    private void annotate(Value value) {
        if (!options.includeAnnotations) return;
        boolean padded = false;
        if (hook != null && value.hasResult()) {
            String annotation = hook.valueAnnotation(value, context);
            if (annotation != null && !annotation.isEmpty()) {
                out.padToColumn(options.annotationColumn).span(StyleClass.COMMENT, annotation);
                padded = true;
            }
        }
        DebugLocation location = value.getDebugLocation();
        if (location != null) {
            if (!padded) {
                out.padToColumn(options.annotationColumn).span(StyleClass.COMMENT, ";");
                padded = true;
            }
            out.span(StyleClass.COMMENT, " [debug line = " + DebugLocationRenderer.render(location) + "]");
        }
        String variable = value.getNullable(CommonExts.DEBUG_VARIABLE);
        if (variable != null) {
            if (!padded) {
                out.padToColumn(options.annotationColumn).span(StyleClass.COMMENT, ";");
            }
            out.span(StyleClass.COMMENT, " [debug variable = " + variable + "]");
        }
    }

    // use-lists

    private List<Use> orderedUses(Value value) {
        List<Use> uses = new ArrayList<>(value.getUses());
        if (!options.preserveUseListOrder) {
            uses.sort(defaultUseOrder());
        }
        return uses;
    }

    private Comparator<Use> defaultUseOrder() {
        return Comparator.<Use>comparingInt(use -> positions.getOrDefault(use.user, Integer.MAX_VALUE))
                .thenComparingInt(use -> use.operandIndex);
    }

    private void renderUseListOrders(List<Value> values, String indent) {
        for (Value value : values) {
            if (!value.hasMultipleUses()) continue;
            List<Use> recorded = value.getUses();
            List<Use> sorted = new ArrayList<>(recorded);
            sorted.sort(defaultUseOrder());
            if (sorted.equals(recorded)) continue;

            StringBuilder indices = new StringBuilder("{ ");
            for (int i = 0; i < sorted.size(); i++) {
                if (i != 0) indices.append(", ");
                indices.append(recorded.indexOf(sorted.get(i)));
            }
            indices.append(" }");

            out.text(indent).span(StyleClass.KEYWORD, "uselistorder").text(" ");
            type(value, value.getType(), "type");
            out.text(" ");
            reference(value);
            out.text(", " + indices).newline();
        }
    }

    // metadata

    private void renderNamedMetadata(String name, List<Value> nodes) {
        out.span(StyleClass.METADATA, Names.identifier('!', name)).text(" = !{");
        boolean first = true;
        for (Value node : nodes) {
            if (!first) out.text(", ");
            first = false;
            if (node == null) {
                out.span(StyleClass.CONSTANT, "null");
            } else {
                reference(node);
            }
        }
        out.text("}").newline();
    }

    private void renderMetadataDefinition(Value node) {
        if (!slots.visitMetadata(node)) return;
        define(node);
        out.text(" = ");
        if (node.isDistinct()) out.span(StyleClass.KEYWORD, "distinct").text(" ");
        out.text("!{");
        List<Value> operands = node.getOperands();
        for (int i = 0; i < operands.size(); i++) {
            if (i != 0) out.text(", ");
            Value operand = operands.get(i);
            if (operand == null) {
                out.span(StyleClass.CONSTANT, "null");
            } else if (isMetadata(operand)) {
                reference(operand);
            } else {
                typedValue(operand);
            }
        }
        out.text("}").newline();
    }

    private static boolean isMetadata(Value value) {
        return value.getKind() == ValueKind.METADATA || value.isMetadataString();
    }

    // names and references

    /**
     * Get the element id of a definition, assigning ids in order of first need.
     */
    private String elementId(Value value) {
        return elementIds.computeIfAbsent(value, $ -> "v" + elementIds.size());
    }

    /**
     * Spell a reference to a value as plain text, or null if it cannot be resolved here.
     */
    private @Nullable String spellOrNull(Value value) {
        ValueKind kind = value.getKind();
        if (kind == ValueKind.CONSTANT) {
            if (value.getLiteral() == null) return null;
            return value.isMetadataString() ? "!" + Names.quoted(value.getLiteral()) : value.getLiteral();
        }
        char sigil = kind.scope.sigil;
        if (kind != ValueKind.METADATA && value.hasName()) {
            return Names.identifier(sigil, value.getName());
        }
        if (kind == ValueKind.INSTRUCTION && !value.hasResult()) {
            // void instructions are never numbered
            Opcode opcode = value.getOpcode();
            return opcode == null ? UNKNOWN_OPCODE : opcode.mnemonic;
        }
        if (kind.scope == ValueKind.Scope.FUNCTION) {
            Function owner = value.getNullable(CommonExts.OWNING_FUNCTION);
            if (owner == null || owner != slots.getFunction()) return null;
        }
        int slot = slots.getSlot(value);
        return slot == SlotTracker.NO_SLOT ? null : sigil + Integer.toString(slot);
    }

    private String spell(Value value) {
        String spelled = spellOrNull(value);
        if (spelled != null) return spelled;
        if (value.getKind() == ValueKind.CONSTANT) {
            malformed(value, "missing literal");
            return MISSING_LITERAL;
        }
        unresolved(value);
        return BAD_REF;
    }

    private static StyleClass styleOf(Value value) {
        switch (value.getKind()) {
            case INSTRUCTION:
            case ARGUMENT:
                return StyleClass.LOCAL;
            case BASIC_BLOCK:
                return StyleClass.LABEL;
            case GLOBAL_VARIABLE:
            case FUNCTION:
                return StyleClass.GLOBAL;
            case METADATA:
                return StyleClass.METADATA;
            default:
                return value.isMetadataString() ? StyleClass.METADATA : StyleClass.CONSTANT;
        }
    }

    private void define(Value value) {
        String spelled = spell(value);
        if (spelled.equals(BAD_REF)) {
            out.span(StyleClass.PLACEHOLDER, spelled);
        } else {
            out.anchor(styleOf(value), elementId(value), spelled);
        }
    }

    void reference(Value value) {
        String spelled = spellOrNull(value);
        if (spelled == null) {
            out.span(StyleClass.PLACEHOLDER, spell(value));
        } else if (value.getKind() == ValueKind.CONSTANT || !value.hasResult()) {
            out.span(styleOf(value), spelled);
        } else {
            out.link(styleOf(value), elementId(value), spelled);
        }
    }

    // operands and types, used by InsnPrinters

    HtmlWriter out() {
        return out;
    }

    void type(Value subject, @Nullable Type type, String what) {
        if (type == null) {
            malformed(subject, "missing " + what);
            placeholder(UNKNOWN_TYPE);
        } else {
            out.span(StyleClass.TYPE, type.toString());
        }
    }

    /**
     * Get an operand, reporting it if it is missing or null.
     */
    @Nullable Value operand(Value insn, int index) {
        if (index >= insn.getNumOperands()) {
            malformed(insn, "missing operand #" + index);
            placeholder(MISSING_OPERAND);
            return null;
        }
        Value operand = insn.getOperand(index);
        if (operand == null) {
            malformed(insn, "null operand #" + index);
            placeholder(NULL_OPERAND);
        }
        return operand;
    }

    void untypedOperand(Value insn, int index) {
        Value operand = operand(insn, index);
        if (operand != null) reference(operand);
    }

    void typedOperand(Value insn, int index) {
        if (index >= insn.getNumOperands() || insn.getOperand(index) == null) {
            operand(insn, index);
            return;
        }
        typedValue(insn.getOperand(index));
    }

    private void typedValue(Value value) {
        if (isMetadata(value)) {
            out.span(StyleClass.KEYWORD, "metadata");
        } else {
            type(value, value.getType(), "type");
        }
        out.text(" ");
        reference(value);
    }

    // diagnostics

    /**
     * Report a defect of a node, at most once per node and defect.
     */
    void malformed(Value node, String defect) {
        report(DiagnosticKind.MALFORMED_NODE, node, defect);
    }

    private void unresolved(Value value) {
        report(DiagnosticKind.UNRESOLVED_REFERENCE, value, "reference to " + value.getKind() + " outside its scope");
    }

    private void report(DiagnosticKind kind, Value node, String defect) {
        if (!reported.computeIfAbsent(node, $ -> new HashSet<>()).add(kind + defect)) return;
        String subject = node.toString();
        Function function = slots.getFunction();
        if (function != null) subject += " in " + function;
        logger.debug("{}: {} at {}", kind, defect, subject);
        diagnostics.report(kind, defect, subject);
    }

    void placeholder(String text) {
        out.span(StyleClass.PLACEHOLDER, text);
    }
}
