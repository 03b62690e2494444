package work.lcod.ui.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.ui.support.AstFixtures.programPath;
import static work.lcod.ui.support.AstFixtures.state;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.compiled.CompiledNode;
import work.lcod.ui.lowering.ProgramLowerer;

class ProgramWriterTest {
    private final ProgramLowerer lowerer = new ProgramLowerer(256);

    @Test
    @SuppressWarnings("unchecked")
    void writesInlinedPage() {
        var compiled = lowerer.lowerPage(ProgramReader.readProgram(programPath("counter.json")));

        var map = ProgramWriter.toMap(compiled);

        assertEquals("1.0", map.get("version"));
        assertFalse(map.containsKey("route"));
        var actions = (List<Map<String, Object>>) map.get("actions");
        assertEquals("increment", actions.get(0).get("name"));
        var view = (Map<String, Object>) map.get("view");
        assertEquals("element", view.get("kind"));
        var section = ((List<Map<String, Object>>) view.get("children")).get(0);
        assertEquals("section", section.get("tag"));
        var onClick = (Map<String, Object>) ((Map<String, Object>) section.get("props")).get("onClick");
        assertEquals(Map.of("event", "click", "action", "increment"), onClick);
    }

    @Test
    @SuppressWarnings("unchecked")
    void layoutsAreTagged() {
        var compiled = lowerer.lowerLayout(ProgramReader.readLayout(programPath("main-layout.json")));

        var map = ProgramWriter.toMap(compiled);

        assertEquals("layout", map.get("type"));
        var view = (Map<String, Object>) map.get("view");
        var header = ((List<Map<String, Object>>) view.get("children")).get(0);
        var title = (Map<String, Object>) ((List<Map<String, Object>>) header.get("children")).get(0);
        assertEquals(Map.of("expr", "param", "name", "title"), title.get("value"));
    }

    @Test
    void nullLiteralsKeepTheirValue() {
        var map = ProgramWriter.expression(Expression.nullLiteral());

        assertTrue(map.containsKey("value"));
        assertNull(map.get("value"));
    }

    @Test
    void optionalMembersAreOmitted() {
        assertEquals(Map.of("expr", "state", "name", "count"), ProgramWriter.expression(state("count")));
        assertEquals(Map.of("kind", "slot"), ProgramWriter.node(new CompiledNode.Slot(null)));
    }

    @Test
    void noOpStepsAreTagged() {
        assertEquals(Map.of("do", "noop"), ProgramWriter.step(ActionStep.NoOp.INSTANCE));
    }

    @Test
    void writeCreatesParentDirectories(@TempDir Path dir) throws Exception {
        var target = dir.resolve("out").resolve("page.json");

        ProgramWriter.write(target, "{}");

        assertEquals("{}", Files.readString(target).trim());
    }
}
