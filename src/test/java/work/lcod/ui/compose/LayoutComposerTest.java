package work.lcod.ui.compose;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.ui.support.AstFixtures.action;
import static work.lcod.ui.support.AstFixtures.component;
import static work.lcod.ui.support.AstFixtures.componentDef;
import static work.lcod.ui.support.AstFixtures.element;
import static work.lcod.ui.support.AstFixtures.lit;
import static work.lcod.ui.support.AstFixtures.param;
import static work.lcod.ui.support.AstFixtures.programPath;
import static work.lcod.ui.support.AstFixtures.props;
import static work.lcod.ui.support.AstFixtures.requiredParams;
import static work.lcod.ui.support.AstFixtures.slot;
import static work.lcod.ui.support.AstFixtures.text;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.ui.analysis.LayoutAnalyzer;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.ast.Program;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;
import work.lcod.ui.compiled.CompiledLayoutProgram;
import work.lcod.ui.compiled.CompiledNode;
import work.lcod.ui.compiled.CompiledProgram;
import work.lcod.ui.io.ProgramReader;
import work.lcod.ui.lowering.ProgramLowerer;

class LayoutComposerTest {
    private final ProgramLowerer lowerer = new ProgramLowerer(256);

    private CompiledLayoutProgram layout() {
        return lowerer.lowerLayout(ProgramReader.readLayout(programPath("main-layout.json")));
    }

    private CompiledProgram page() {
        return lowerer.lowerPage(ProgramReader.readProgram(programPath("post-page.json")));
    }

    private static CompiledNode.Element compiledElement(String tag, CompiledNode... children) {
        return new CompiledNode.Element(tag, null, Map.of(), List.of(children));
    }

    private static CompiledNode.Text compiledText(Object value) {
        return new CompiledNode.Text(Expression.literal(value));
    }

    @Test
    void splicesPageParamsAndImportedContent() {
        var page = page();
        var composer = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY);

        var composed = composer.compose(layout(), page);

        var expected = compiledElement("div",
            compiledElement("header", compiledText("Blog"), CompiledNode.Text.empty()),
            page.view(),
            compiledElement("aside", compiledElement("p", compiledText("Imported")))
        );
        assertEquals(expected, composed.view());
        assertEquals(page.route(), composed.route());
    }

    @Test
    void keepPolicyLeavesUnfilledSlots() {
        var composer = new LayoutComposer(lowerer, UnmatchedSlotPolicy.KEEP);

        var composed = (CompiledNode.Element) composer.compose(layout(), page()).view();

        var header = (CompiledNode.Element) composed.children().get(0);
        assertEquals(new CompiledNode.Slot("nav"), header.children().get(1));
    }

    @Test
    void missingLayoutParamsResolveToNull() {
        var composer = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY);

        var composed = (CompiledNode.Element) composer.compose(layout(), page(), Map.of(), null).view();

        var header = (CompiledNode.Element) composed.children().get(0);
        assertEquals(new CompiledNode.Text(Expression.nullLiteral()), header.children().get(0));
    }

    @Test
    void explicitNamedSlotsReplaceImportedContent() {
        var composer = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY);

        var composed = (CompiledNode.Element) composer.compose(
            layout(),
            page(),
            Map.of("title", lit("Docs")),
            Map.of("nav", element("nav", text("Home")))
        ).view();

        var header = (CompiledNode.Element) composed.children().get(0);
        assertEquals(compiledText("Docs"), header.children().get(0));
        assertEquals(compiledElement("nav", compiledText("Home")), header.children().get(1));
        var aside = (CompiledNode.Element) composed.children().get(2);
        assertEquals(CompiledNode.Text.empty(), aside.children().get(0));
    }

    @Test
    void collidingStateIsRenamed() {
        var composed = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY).compose(layout(), page());

        assertEquals(List.of("count", "menuOpen", "$layout.count"), List.copyOf(composed.state().keySet()));
        assertEquals(0, ((Number) composed.state().get("count").initial()).intValue());
        assertEquals(100, ((Number) composed.state().get("$layout.count").initial()).intValue());
    }

    @Test
    void collidingActionsAreRenamed() {
        var composed = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY).compose(layout(), page());

        assertEquals(
            List.of("increment", "toggleMenu", "$layout.increment"),
            List.copyOf(composed.actions().keySet())
        );
        assertEquals("$layout.increment", composed.actions().get("$layout.increment").name());
    }

    @Test
    void cachedLayoutIsReusable() {
        var layout = layout();
        var untouched = layout();
        var composer = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY);

        var first = composer.compose(layout, page());
        var second = composer.compose(layout, page());

        assertEquals(first, second);
        assertNotSame(first.view(), second.view());
        assertEquals(untouched, layout);
    }

    @Test
    void layoutStateAndActionsReadLayoutParams() {
        var source = new LayoutProgram(
            null,
            Map.of("greeting", new StateField("string", param("title"))),
            List.of(action("greet", new ActionStep.Set("greeting", param("title")))),
            element("div", slot()),
            Map.of(),
            Map.of()
        );
        assertTrue(new LayoutAnalyzer().analyze(source).isSuccess());
        var layout = lowerer.lowerLayout(source);
        var page = lowerer.lowerPage(Program.of(element("p")));
        var composer = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY);

        var bound = composer.compose(layout, page, Map.of("title", lit("Blog")), null);
        var unbound = composer.compose(layout, page, Map.of(), null);

        assertEquals(lit("Blog"), bound.state().get("greeting").initial());
        assertEquals(List.of(new ActionStep.Set("greeting", lit("Blog"))), bound.actions().get("greet").steps());
        assertEquals(Expression.nullLiteral(), unbound.state().get("greeting").initial());
        assertEquals(
            List.of(new ActionStep.Set("greeting", Expression.nullLiteral())),
            unbound.actions().get("greet").steps()
        );
    }

    @Test
    void namedSlotContentInlinesLayoutComponents() {
        var banner = componentDef(requiredParams("text"), element("section", element("h1", text(param("text")))));
        var source = new LayoutProgram(
            null,
            Map.of(),
            List.of(),
            element("div", slot("header"), slot(), slot("footer")),
            Map.of("Banner", banner),
            Map.of()
        );
        var layout = lowerer.lowerLayout(source);
        var page = lowerer.lowerPage(Program.of(element("p")));
        Map<String, ViewNode> named = Map.of("header", component("Banner", props("text", lit("Top"))));

        var empty = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY).compose(layout, page, Map.of(), named);
        var kept = new LayoutComposer(lowerer, UnmatchedSlotPolicy.KEEP).compose(layout, page, Map.of(), named);

        var header = compiledElement("section", compiledElement("h1", compiledText("Top")));
        assertEquals(compiledElement("div", header, compiledElement("p"), CompiledNode.Text.empty()), empty.view());
        assertEquals(compiledElement("div", header, compiledElement("p"), new CompiledNode.Slot("footer")), kept.view());
    }

    @Test
    void importedContentInlinesPageComponents() {
        var note = componentDef(Map.of(), element("em", slot()));
        var content = Map.of(
            "kind", "component",
            "name", "Note",
            "children", List.of(Map.of("kind", "text", "value", Map.of("expr", "lit", "value", "hi")))
        );
        var source = new Program(
            null,
            Map.of(),
            List.of(),
            element("p"),
            null,
            null,
            Map.of("Note", note),
            Map.of("docs", List.of(Map.of("content", content)))
        );
        var layout = lowerer.lowerLayout(LayoutProgram.of(element("div", slot(LayoutComposer.MDX_CONTENT_SLOT), slot())));

        var composed = new LayoutComposer(lowerer, UnmatchedSlotPolicy.EMPTY).compose(layout, lowerer.lowerPage(source));

        var expected = compiledElement("div", compiledElement("em", compiledText("hi")), compiledElement("p"));
        assertEquals(expected, composed.view());
        assertTrue(composed.components().containsKey("Note"));
    }
}
