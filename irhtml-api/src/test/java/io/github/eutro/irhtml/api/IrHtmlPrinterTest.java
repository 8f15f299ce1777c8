package io.github.eutro.irhtml.api;

import io.github.eutro.irhtml.api.support.OutputNaming;
import io.github.eutro.irhtml.core.ir.Function;
import io.github.eutro.irhtml.core.ir.IRBuilder;
import io.github.eutro.irhtml.core.ir.Module;
import io.github.eutro.irhtml.core.ir.Type;
import io.github.eutro.irhtml.core.render.RenderOptions;
import io.github.eutro.irhtml.core.render.RenderResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IrHtmlPrinterTest {
    private static Module module(String id) {
        Module module = new Module(id);
        Function f = module.addFunction("main", Type.VOID);
        new IRBuilder(f, f.newBb()).ret();
        return module;
    }

    @Test
    void testPrintTo() throws IOException {
        StringWriter sw = new StringWriter();
        RenderResult result = new IrHtmlPrinter().printTo(module("m"), sw);
        assertEquals(result.document, sw.toString());
        assertTrue(result.document.startsWith("<!DOCTYPE html>"));
        assertFalse(result.document.contains("[#uses"));
    }

    @Test
    void testAnnotationsFromOptions() {
        RenderResult result = new IrHtmlPrinter()
                .withOptions(RenderOptions.builder().includeAnnotations(true).build())
                .print(module("m"));
        assertTrue(result.content.contains("[#uses=0]"));

        RenderResult bare = new IrHtmlPrinter()
                .withOptions(RenderOptions.builder().includeAnnotations(true).build())
                .withHook(null)
                .print(module("m"));
        assertFalse(bare.content.contains("[#uses"));
    }

    @Test
    void testWriteAll(@TempDir Path dir) throws IOException {
        List<RenderResult> results = new IrHtmlPrinter()
                .writeAll(Arrays.asList(module("first"), module("second")), "prog.bc", null, dir);
        assertEquals(2, results.size());
        assertEquals(results.get(0).document,
                new String(Files.readAllBytes(dir.resolve("prog.0.html")), StandardCharsets.UTF_8));
        assertTrue(Files.exists(dir.resolve("prog.1.html")));
    }

    @Test
    void testWriteToStdout(@TempDir Path dir) throws IOException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        List<RenderResult> results = new IrHtmlPrinter()
                .withStdout(stdout)
                .writeAll(Collections.singletonList(module("piped")), "-", null, dir);
        assertEquals(results.get(0).document, new String(stdout.toByteArray(), StandardCharsets.UTF_8));
    }

    @Test
    void testStdoutOverrideWithManyModules(@TempDir Path dir) throws IOException {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        List<RenderResult> results = new IrHtmlPrinter()
                .withStdout(stdout)
                .writeAll(Arrays.asList(module("first"), module("second")), "prog.bc", OutputNaming.STDOUT, dir);
        assertEquals(2, results.size());
        assertEquals(0, stdout.size());
        assertTrue(Files.exists(dir.resolve("-.0")));
        assertTrue(Files.exists(dir.resolve("-.1")));
    }

    @Test
    void testOverrideWithManyInputs(@TempDir Path dir) {
        Map<String, List<Module>> inputs = new LinkedHashMap<>();
        inputs.put("a.bc", Collections.singletonList(module("a")));
        inputs.put("b.bc", Collections.singletonList(module("b")));
        IrHtmlPrinter printer = new IrHtmlPrinter();
        assertThrows(IllegalArgumentException.class, () -> printer.writeInputs(inputs, "out.html", dir));
    }

    @Test
    void testManyInputs(@TempDir Path dir) throws IOException {
        Map<String, List<Module>> inputs = new LinkedHashMap<>();
        inputs.put("a.bc", Collections.singletonList(module("a")));
        inputs.put("b.bc", Arrays.asList(module("b0"), module("b1")));
        List<RenderResult> results = new IrHtmlPrinter().writeInputs(inputs, null, dir);
        assertEquals(3, results.size());
        assertTrue(Files.exists(dir.resolve("a.html")));
        assertTrue(Files.exists(dir.resolve("b.0.html")));
        assertTrue(Files.exists(dir.resolve("b.1.html")));
    }
}
