package io.github.eutro.irhtml.api;

import io.github.eutro.irhtml.api.annotations.CommentAnnotations;
import io.github.eutro.irhtml.api.support.OutputNaming;
import io.github.eutro.irhtml.core.ir.Module;
import io.github.eutro.irhtml.core.render.AnnotationHook;
import io.github.eutro.irhtml.core.render.RenderOptions;
import io.github.eutro.irhtml.core.render.RenderResult;
import io.github.eutro.irhtml.core.render.Renderer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders modules to HTML documents, and writes them where they should go.
 *
 * <pre>{@code
 * new IrHtmlPrinter()
 *         .withOptions(RenderOptions.builder().includeAnnotations(true).build())
 *         .writeAll(modules, "input.bc", null, Paths.get("out"));
 * }</pre>
 */
public class IrHtmlPrinter {
    private static final Logger logger = LogManager.getLogger(IrHtmlPrinter.class);

    private final RenderOptions options;
    private final @Nullable AnnotationHook hook;
    private final OutputStream stdout;

    public IrHtmlPrinter() {
        this(RenderOptions.DEFAULT, CommentAnnotations.INSTANCE, System.out);
    }

    private IrHtmlPrinter(RenderOptions options, @Nullable AnnotationHook hook, OutputStream stdout) {
        this.options = options;
        this.hook = hook;
        this.stdout = stdout;
    }

    @Contract(pure = true)
    public IrHtmlPrinter withOptions(RenderOptions options) {
        return new IrHtmlPrinter(options, hook, stdout);
    }

    /**
     * Use a different annotation hook. It is only called if the options include annotations.
     *
     * @param hook The hook, or null for none.
     * @return A printer with the hook.
     */
    @Contract(pure = true)
    public IrHtmlPrinter withHook(@Nullable AnnotationHook hook) {
        return new IrHtmlPrinter(options, hook, stdout);
    }

    @Contract(pure = true)
    public IrHtmlPrinter withStdout(OutputStream stdout) {
        return new IrHtmlPrinter(options, hook, stdout);
    }

    public RenderOptions getOptions() {
        return options;
    }

    @Contract(pure = true)
    @NotNull
    public RenderResult print(Module module) {
        return Renderer.render(module, options, hook);
    }

    /**
     * Render a module, writing the document to a writer.
     *
     * @param module The module.
     * @param writer The writer, which is flushed but not closed.
     * @return The result.
     * @throws IOException If writing fails.
     */
    public RenderResult printTo(Module module, Writer writer) throws IOException {
        RenderResult result = print(module);
        writer.write(result.document);
        writer.flush();
        return result;
    }

    /**
     * Render all the modules read from one input, each to the file {@link OutputNaming} picks.
     *
     * @param modules   The modules of the input.
     * @param inputName The name of the input, or {@link OutputNaming#STDOUT} for standard input.
     * @param override  The output name asked for, or null to derive one.
     * @param directory The directory relative output names resolve against.
     * @return The results, in module order.
     * @throws IOException If writing fails.
     */
    public List<RenderResult> writeAll(
            List<Module> modules,
            String inputName,
            @Nullable String override,
            Path directory
    ) throws IOException {
        int count = modules.size();
        if (OutputNaming.STDOUT.equals(override) && count > 1) {
            logger.warn("Only single-module inputs can be written to stdout, writing {} modules to files instead", count);
        }
        List<RenderResult> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String name = OutputNaming.outputName(inputName, override, i, count);
            if (OutputNaming.STDOUT.equals(name)) {
                Writer writer = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
                results.add(printTo(modules.get(i), writer));
            } else {
                Path path = directory.resolve(name);
                logger.info("Writing {}", path);
                try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                    results.add(printTo(modules.get(i), writer));
                }
            }
        }
        return results;
    }

    /**
     * Render the modules of several inputs at once.
     *
     * @param inputs    The modules of each input, by input name.
     * @param override  The output name asked for, which is only allowed for a single input.
     * @param directory The directory relative output names resolve against.
     * @return All the results, in input order then module order.
     * @throws IOException If writing fails.
     */
    public List<RenderResult> writeInputs(
            Map<String, List<Module>> inputs,
            @Nullable String override,
            Path directory
    ) throws IOException {
        if (override != null && !override.isEmpty() && inputs.size() > 1) {
            throw new IllegalArgumentException("An output name can't be given for multiple inputs");
        }
        List<RenderResult> results = new ArrayList<>();
        for (Map.Entry<String, List<Module>> input : inputs.entrySet()) {
            results.addAll(writeAll(input.getValue(), input.getKey(), override, directory));
        }
        return results;
    }
}
