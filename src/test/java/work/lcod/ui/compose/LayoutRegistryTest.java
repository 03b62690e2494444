package work.lcod.ui.compose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.ui.support.AstFixtures.element;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.compiled.CompiledLayoutProgram;
import work.lcod.ui.lowering.ProgramLowerer;

class LayoutRegistryTest {
    private static CompiledLayoutProgram sampleLayout() {
        return new ProgramLowerer(16).lowerLayout(LayoutProgram.of(element("main")));
    }

    @Test
    void registeredLayoutsAreFound() {
        var layout = sampleLayout();
        var registry = new LayoutRegistry().register("base", layout);

        assertSame(layout, registry.resolve("base"));
        assertTrue(registry.find("other").isEmpty());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void unknownLayoutIsReported() {
        var error = assertThrows(LayoutNotFoundException.class, () -> new LayoutRegistry().resolve("ghost"));

        assertEquals("ghost", error.layoutName());
        assertEquals("Layout not found: ghost", error.getMessage());
    }

    @Test
    void loaderResultsAreCached() {
        var calls = new AtomicInteger();
        var layout = sampleLayout();
        var registry = new LayoutRegistry(name -> {
            calls.incrementAndGet();
            return "base".equals(name) ? layout : null;
        });

        assertSame(layout, registry.resolve("base"));
        assertSame(layout, registry.resolve("base"));
        assertEquals(1, calls.get());
        assertTrue(registry.names().contains("base"));
    }

    @Test
    void unregisterDropsTheEntry() {
        var registry = new LayoutRegistry().register("base", sampleLayout());

        registry.unregister("base");

        assertTrue(registry.find("base").isEmpty());
    }
}
