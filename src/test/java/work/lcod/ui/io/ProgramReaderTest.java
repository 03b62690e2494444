package work.lcod.ui.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.RouteSource;
import work.lcod.ui.ast.ViewNode;
import work.lcod.ui.support.AstFixtures;

class ProgramReaderTest {
    @Test
    void readsJsonProgram() {
        var program = ProgramReader.readProgram(AstFixtures.programPath("counter.json"));

        assertEquals("1.0", program.version());
        assertEquals(0, program.state().get("count").initial());
        assertEquals("increment", program.actions().get(0).name());
        assertInstanceOf(ActionStep.Set.class, program.actions().get(0).steps().get(0));

        var card = program.components().get("Card");
        assertTrue(card.params().get("title").required());
        assertFalse(card.params().get("onPick").required());
        assertEquals("string", card.params().get("title").type());

        var main = assertInstanceOf(ViewNode.Element.class, program.view());
        var call = assertInstanceOf(ViewNode.Component.class, main.children().get(0));
        var handler = assertInstanceOf(EventHandler.class, call.props().get("onPick"));
        assertEquals("increment", handler.action());
    }

    @Test
    void readsYamlProgram() {
        var program = ProgramReader.readProgram(AstFixtures.programPath("counter.yaml"));

        assertEquals("1.0", program.version());
        var button = assertInstanceOf(ViewNode.Element.class, program.view());
        assertEquals("button", button.tag());
        assertInstanceOf(EventHandler.class, button.props().get("onClick"));
    }

    @Test
    void detectsLayoutFiles() {
        assertTrue(ProgramReader.isLayoutFile(AstFixtures.programPath("main-layout.json")));
        assertFalse(ProgramReader.isLayoutFile(AstFixtures.programPath("counter.json")));
    }

    @Test
    void readsRouteAndImportData() {
        var program = ProgramReader.readProgram(AstFixtures.programPath("post-page.json"));

        assertEquals("/posts/:slug", program.route().path());
        assertEquals("main-layout", program.route().layout());
        assertEquals(Expression.literal("Blog"), program.route().layoutParams().get("title"));
        assertTrue(program.importData().containsKey("posts"));
    }

    @Test
    void routeSourceDefaultsToParam() {
        var program = ProgramReader.parseProgram("""
            {"view": {"kind": "text", "value": {"expr": "route", "name": "q", "source": "query"}},
             "state": {"n": {"type": "number", "initial": {"expr": "route", "name": "id"}}}}
            """);

        var text = assertInstanceOf(ViewNode.Text.class, program.view());
        assertEquals(RouteSource.QUERY, ((Expression.RouteRef) text.value()).source());
        var initial = assertInstanceOf(Expression.RouteRef.class, program.state().get("n").initial());
        assertEquals(RouteSource.PARAM, initial.source());
    }

    @Test
    void keepsUnknownStepsForTheLowerer() {
        var program = ProgramReader.parseProgram("""
            {"actions": [{"name": "a", "steps": [{"do": "teleport", "where": "moon"}]}],
             "view": {"kind": "text", "value": {"expr": "lit", "value": null}}}
            """);

        var step = assertInstanceOf(ActionStep.Unknown.class, program.actions().get(0).steps().get(0));
        assertEquals("teleport", step.tag());
        assertEquals("moon", step.raw().get("where"));
        var text = assertInstanceOf(ViewNode.Text.class, program.view());
        assertNull(((Expression.Literal) text.value()).value());
    }

    @Test
    void readsPayloadObjectsAsNamedExpressions() {
        var program = ProgramReader.parseProgram("""
            {"actions": [{"name": "pick", "steps": []}],
             "view": {"kind": "element", "tag": "button", "props": {
               "onClick": {"event": "click", "action": "pick", "debounce": 200,
                           "payload": {"id": {"expr": "lit", "value": 7}}}}}}
            """);

        var button = assertInstanceOf(ViewNode.Element.class, program.view());
        var handler = assertInstanceOf(EventHandler.class, button.props().get("onClick"));
        assertNull(handler.payload());
        assertEquals(Expression.literal(7), handler.payloadFields().get("id"));
        assertEquals(200, handler.debounce());
    }

    @Test
    void keepsLargeNumbersExact() {
        var program = ProgramReader.parseProgram("""
            {"view": {"kind": "text", "value": {"expr": "lit", "value": 123456789012345678901234567890}}}
            """);

        var text = assertInstanceOf(ViewNode.Text.class, program.view());
        assertEquals(new BigInteger("123456789012345678901234567890"), ((Expression.Literal) text.value()).value());
    }

    @Test
    void unknownViewKindReportsItsPointer() {
        var ex = assertThrows(ProgramFormatException.class, () -> ProgramReader.parseProgram("""
            {"view": {"kind": "element", "tag": "div", "children": [{"kind": "hologram"}]}}
            """));

        assertEquals("/view/children/0/kind", ex.pointer());
        assertTrue(ex.getMessage().contains("hologram"));
    }

    @Test
    void missingViewIsAFormatError() {
        var ex = assertThrows(ProgramFormatException.class, () -> ProgramReader.parseProgram("{}"));

        assertEquals("/view", ex.pointer());
    }

    @Test
    void malformedJsonIsAFormatError() {
        assertThrows(ProgramFormatException.class, () -> ProgramReader.parseProgram("{\"view\": "));
        assertThrows(ProgramFormatException.class, () -> ProgramReader.parseProgram("[1, 2]"));
    }

    @Test
    void missingFileFailsWithItsPath() {
        var path = AstFixtures.programPath("does-not-exist.json");

        var ex = assertThrows(IllegalStateException.class, () -> ProgramReader.readProgram(path));

        assertTrue(ex.getMessage().startsWith("Failed to read program: "));
        assertTrue(ex.getMessage().contains("does-not-exist.json"));
    }
}
