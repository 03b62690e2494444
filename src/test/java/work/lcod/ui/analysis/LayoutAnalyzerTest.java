package work.lcod.ui.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.ui.support.AstFixtures.component;
import static work.lcod.ui.support.AstFixtures.componentDef;
import static work.lcod.ui.support.AstFixtures.each;
import static work.lcod.ui.support.AstFixtures.element;
import static work.lcod.ui.support.AstFixtures.param;
import static work.lcod.ui.support.AstFixtures.slot;
import static work.lcod.ui.support.AstFixtures.state;
import static work.lcod.ui.support.AstFixtures.text;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.io.ProgramReader;
import work.lcod.ui.support.AstFixtures;

class LayoutAnalyzerTest {
    private final LayoutAnalyzer analyzer = new LayoutAnalyzer();

    @Test
    void acceptsLayoutWithNamedAndDefaultSlots() {
        var result = analyzer.analyze(ProgramReader.readLayout(AstFixtures.programPath("main-layout.json")));

        assertTrue(result.isSuccess(), () -> result.errors().toString());
        assertEquals(Set.of("nav", "mdx-content"), result.context().slotNames());
        assertTrue(result.context().hasDefaultSlot());
        assertTrue(result.context().names().stateNames().contains("menuOpen"));
    }

    @Test
    void layoutParamsAreAllowedAtLayoutLevel() {
        var result = analyzer.analyze(LayoutProgram.of(element("div", text(param("title")), slot())));

        assertTrue(result.isSuccess(), () -> result.errors().toString());
    }

    @Test
    void requiresAtLeastOneSlot() {
        var result = analyzer.analyze(LayoutProgram.of(element("div", text("no slot"))));

        assertEquals(1, result.errors().size());
        assertEquals(ErrorCode.LAYOUT_MISSING_SLOT, result.errors().get(0).code());
        assertEquals("/view", result.errors().get(0).path());
    }

    @Test
    void rejectsSlotsInsideLoops() {
        var view = element("ul", each(state("items"), "item", slot("row")));

        var result = analyzer.analyze(LayoutProgram.of(view));

        assertEquals(1, result.errors().size());
        assertEquals(ErrorCode.SLOT_IN_LOOP, result.errors().get(0).code());
        assertEquals("/view/children/0/body", result.errors().get(0).path());
    }

    @Test
    void rejectsDuplicateSlots() {
        var view = element("div", slot(), slot(), slot("aside"), slot("aside"));

        var result = analyzer.analyze(LayoutProgram.of(view));

        assertEquals(2, result.errors().size());
        assertEquals(ErrorCode.DUPLICATE_DEFAULT_SLOT, result.errors().get(0).code());
        assertEquals("/view/children/1", result.errors().get(0).path());
        assertEquals(ErrorCode.DUPLICATE_SLOT_NAME, result.errors().get(1).code());
        assertEquals("/view/children/3", result.errors().get(1).path());
    }

    @Test
    void slotErrorsAreReportedWithoutReferenceErrors() {
        var view = element("div", text(state("ghost")), slot("a"), slot("a"));

        var result = analyzer.analyze(LayoutProgram.of(view));

        assertEquals(1, result.errors().size());
        assertEquals(ErrorCode.DUPLICATE_SLOT_NAME, result.errors().get(0).code());
    }

    @Test
    void referenceErrorsFollowOnceSlotsAreSound() {
        var view = element("div", text(state("ghost")), slot());

        var result = analyzer.analyze(LayoutProgram.of(view));

        assertEquals(1, result.errors().size());
        assertEquals(ErrorCode.UNDEFINED_STATE, result.errors().get(0).code());
    }

    @Test
    void slotsPassedToComponentsCount() {
        var frame = componentDef(Map.of(), element("section", slot()));
        var layout = new LayoutProgram(
            null,
            Map.of(),
            List.of(),
            component("Frame", Map.of(), slot("body")),
            Map.of("Frame", frame),
            Map.of()
        );

        var result = analyzer.analyze(layout);

        assertTrue(result.isSuccess(), () -> result.errors().toString());
        assertEquals(Set.of("body"), result.context().slotNames());
        assertFalse(result.context().hasDefaultSlot());
    }

    @Test
    void slotBelowTheCeilingReportsDepthInsteadOfMissingSlot() {
        var layout = LayoutProgram.of(element("div", element("section", slot())));

        var result = new LayoutAnalyzer(2).analyze(layout);

        assertEquals(1, result.errors().size());
        assertEquals(ErrorCode.MAX_DEPTH_EXCEEDED, result.errors().get(0).code());
        assertEquals("/view/children/0/children/0", result.errors().get(0).path());
    }
}
