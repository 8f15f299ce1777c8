package io.github.eutro.irhtml.core.render;

import io.github.eutro.irhtml.core.ir.DebugLocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DebugLocationRendererTest {
    @Test
    void testInlinedChain() {
        assertEquals("3:10", DebugLocationRenderer.render(new DebugLocation(3, 10)));
        assertEquals("3:10@7:2", DebugLocationRenderer.render(new DebugLocation(3, 10, new DebugLocation(7, 2))));
        assertEquals("", DebugLocationRenderer.render(null));
    }

    @Test
    void testDeepChain() {
        DebugLocation loc = null;
        for (int i = 0; i < 100_000; i++) {
            loc = new DebugLocation(i, 1, loc);
        }
        String rendered = DebugLocationRenderer.render(loc);
        assertTrue(rendered.startsWith("99999:1@99998:1@"));
        assertTrue(rendered.endsWith("@0:1"));
    }
}
