package io.github.eutro.irhtml.api.annotations;

import io.github.eutro.irhtml.core.ir.*;
import io.github.eutro.irhtml.core.ir.Module;
import io.github.eutro.irhtml.core.render.RenderOptions;
import io.github.eutro.irhtml.core.render.RenderResult;
import io.github.eutro.irhtml.core.render.Renderer;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommentAnnotationsTest {
    private static final RenderOptions ANNOTATED = RenderOptions.builder().includeAnnotations(true).build();

    private static String line(RenderResult result, String prefix) {
        String text = Jsoup.parse(result.document).selectFirst("pre").wholeText();
        for (String line : text.split("\n")) {
            if (line.startsWith(prefix)) return line;
        }
        return fail("no line starting with " + prefix + " in:\n" + text);
    }

    @Test
    void testCounts() {
        Module module = new Module("counts");
        Value g = module.addGlobal("g", Type.I32, false, Value.constant(Type.I32, 1));
        Function f = module.addFunction("f", Type.I32);
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Value v = ib.load(Type.I32, g).setName("v");
        ib.ret(ib.binary(Opcode.ADD, v, v).setName("sum"));

        Function caller = module.addFunction("caller", Type.VOID);
        IRBuilder cb = new IRBuilder(caller, caller.newBb());
        cb.call(f).setName("ignored");
        cb.ret();

        RenderResult result = Renderer.render(module, ANNOTATED, CommentAnnotations.INSTANCE);
        assertTrue(line(result, "@g").endsWith("; [#uses=1 type=ptr]"));
        assertEquals(50, line(result, "  %v").indexOf(';'));
        assertTrue(line(result, "  %v").endsWith("; [#uses=2 type=i32]"));
        assertTrue(line(result, "  %sum").endsWith("; [#uses=1 type=i32]"));
        assertEquals("define i32 @f() { ; [#uses=1]", line(result, "define i32 @f"));
        assertEquals("define void @caller() { ; [#uses=0]", line(result, "define void @caller"));
        assertTrue(result.diagnostics.isEmpty());
    }

    @Test
    void testUsersFollowUseListOrder() {
        Module module = new Module("users");
        Function f = module.addFunction("f", Type.VOID);
        Value p = f.addArgument(Type.I32, "p");
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Value x = ib.binary(Opcode.ADD, p, p).setName("x");
        Value one = Value.constant(Type.I32, 1);
        ib.binary(Opcode.MUL, x, one).setName("a");
        ib.binary(Opcode.MUL, x, one).setName("b");
        ib.binary(Opcode.MUL, x, one).setName("c");
        ib.ret();
        List<Use> uses = x.getUses();
        x.setUseListOrder(Arrays.asList(uses.get(2), uses.get(0), uses.get(1)));

        RenderResult normal = Renderer.render(module, ANNOTATED, CommentAnnotations.WITH_USERS);
        assertTrue(line(normal, "  %x").endsWith("; [#uses=3 type=i32] [users=%a, %b, %c]"));

        RenderResult preserved = Renderer.render(module,
                ANNOTATED.toBuilder().preserveUseListOrder(true).build(),
                CommentAnnotations.WITH_USERS);
        assertTrue(line(preserved, "  %x").endsWith("; [#uses=3 type=i32] [users=%c, %a, %b]"));
        assertEquals("  uselistorder i32 %x, { 1, 2, 0 }", line(preserved, "  uselistorder"));
    }

    @Test
    void testVoidUsersAreNotNumbered() {
        Module module = new Module("void-users");
        Function f = module.addFunction("f", Type.VOID);
        Value p = f.addArgument(Type.PTR, "p");
        IRBuilder ib = new IRBuilder(f, f.newBb("entry"));
        Value sum = ib.binary(Opcode.ADD, Value.constant(Type.I32, 1), Value.constant(Type.I32, 2));
        ib.store(sum, p);
        ib.binary(Opcode.ADD, sum, sum);
        ib.ret();

        RenderResult result = Renderer.render(module, ANNOTATED, CommentAnnotations.WITH_USERS);
        assertTrue(line(result, "  %0").endsWith("; [#uses=3 type=i32] [users=store, %1, %1]"),
                line(result, "  %0"));
        assertTrue(line(result, "  store").startsWith("  store i32 %0, ptr %p"));
        assertTrue(line(result, "  %1").startsWith("  %1 = add i32 %0, %0"));
        assertTrue(result.diagnostics.isEmpty(), result.diagnostics.toString());
    }
}
