package work.lcod.ui.lowering;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static work.lcod.ui.support.AstFixtures.component;
import static work.lcod.ui.support.AstFixtures.componentDef;
import static work.lcod.ui.support.AstFixtures.each;
import static work.lcod.ui.support.AstFixtures.element;
import static work.lcod.ui.support.AstFixtures.lit;
import static work.lcod.ui.support.AstFixtures.param;
import static work.lcod.ui.support.AstFixtures.props;
import static work.lcod.ui.support.AstFixtures.requiredParams;
import static work.lcod.ui.support.AstFixtures.slot;
import static work.lcod.ui.support.AstFixtures.state;
import static work.lcod.ui.support.AstFixtures.text;
import static work.lcod.ui.support.AstFixtures.variable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.ParamDef;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;
import work.lcod.ui.compiled.CompiledNode;

class ViewLowererTest {
    private final ExpressionLowerer expressions = new ExpressionLowerer();
    private final ViewLowerer lowerer = new ViewLowerer(expressions, new ActionLowerer(expressions), 256);

    private CompiledNode lower(ViewNode view, Map<String, ComponentDef> components) {
        return lowerer.lower(view, LoweringScope.root(components));
    }

    private static CompiledNode.Element compiledElement(String tag, CompiledNode... children) {
        return new CompiledNode.Element(tag, null, Map.of(), List.of(children));
    }

    private static CompiledNode.Text compiledText(Expression value) {
        return new CompiledNode.Text(value);
    }

    @Test
    void inlinesComponentWithPropsAndChildren() {
        var card = componentDef(requiredParams("title"), element("section", element("h2", text(param("title"))), slot()));
        var view = component("Card", props("title", lit("Hello")), text("body"));

        var lowered = lower(view, Map.of("Card", card));

        var expected = compiledElement("section",
            compiledElement("h2", compiledText(lit("Hello"))),
            compiledText(lit("body"))
        );
        assertEquals(expected, lowered);
    }

    @Test
    void slotWithoutChildrenBecomesEmptyText() {
        var box = componentDef(Map.of(), element("div", slot()));

        var lowered = lower(component("Box", Map.of()), Map.of("Box", box));

        assertEquals(compiledElement("div", CompiledNode.Text.empty()), lowered);
    }

    @Test
    void severalChildrenAreWrappedInSpan() {
        var box = componentDef(Map.of(), element("div", slot()));

        var lowered = lower(component("Box", Map.of(), text("a"), text("b")), Map.of("Box", box));

        var span = new CompiledNode.Element(
            ViewLowerer.SLOT_WRAPPER_TAG,
            null,
            Map.of(),
            List.of(compiledText(lit("a")), compiledText(lit("b")))
        );
        assertEquals(compiledElement("div", span), lowered);
    }

    @Test
    void eachSlotGetsItsOwnCopy() {
        var twice = componentDef(Map.of(), element("div", slot(), slot()));

        var lowered = (CompiledNode.Element) lower(component("Twice", Map.of(), element("p")), Map.of("Twice", twice));

        assertEquals(lowered.children().get(0), lowered.children().get(1));
        assertNotSame(lowered.children().get(0), lowered.children().get(1));
    }

    @Test
    void callerFrameIsNotVisibleInsideNestedDefinitions() {
        var components = new LinkedHashMap<String, ComponentDef>();
        components.put("Outer", componentDef(requiredParams("x"), component("Inner", Map.of())));
        components.put("Inner", componentDef(Map.of(), text(param("x"))));

        var lowered = lower(component("Outer", props("x", lit(1))), components);

        assertEquals(compiledText(Expression.nullLiteral()), lowered);
    }

    @Test
    void propsAndChildrenAreLoweredUnderTheCallerFrame() {
        var components = new LinkedHashMap<String, ComponentDef>();
        components.put("Outer", componentDef(
            requiredParams("label"),
            component("Inner", props("text", param("label")), text(param("label", "upper")))
        ));
        components.put("Inner", componentDef(requiredParams("text"), element("div", text(param("text")), slot())));
        var label = new Expression.StateRef("labels", "main");

        var lowered = lower(component("Outer", props("label", label)), components);

        var expected = compiledElement("div",
            compiledText(label),
            compiledText(new Expression.StateRef("labels", "main.upper"))
        );
        assertEquals(expected, lowered);
    }

    @Test
    void unknownComponentBecomesPlaceholder() {
        var lowered = lower(element("main", component("Ghost", Map.of())), Map.of());

        assertEquals(compiledElement("main", ViewLowerer.placeholder()), lowered);
    }

    @Test
    void handlersFlowThroughParams() {
        var handler = EventHandler.of("click", "save");
        var button = componentDef(
            requiredParams("onPress"),
            element("button", props("onClick", param("onPress")))
        );

        var lowered = (CompiledNode.Element) lower(component("Button", props("onPress", handler)), Map.of("Button", button));

        assertEquals(handler, lowered.props().get("onClick"));
    }

    @Test
    void localStateInitialsAreSpecializedPerCall() {
        var params = new LinkedHashMap<String, ParamDef>();
        params.put("data", ParamDef.optional("array"));
        var initial = new Expression.Call(null, "bounds", List.of(param("data")));
        var chart = new ComponentDef(
            params,
            Map.of("_bounds", new StateField("object", initial)),
            List.of(),
            element("svg")
        );
        var components = Map.of("Chart", chart);

        var bound = lower(component("Chart", props("data", lit(List.of(1, 2, 3)))), components);
        var omitted = lower(component("Chart", Map.of()), components);

        var boundState = assertInstanceOf(CompiledNode.LocalState.class, bound);
        assertEquals(
            new Expression.Call(null, "bounds", List.of(lit(List.of(1, 2, 3)))),
            boundState.state().get("_bounds").initial()
        );
        assertEquals(compiledElement("svg"), boundState.child());
        var omittedState = assertInstanceOf(CompiledNode.LocalState.class, omitted);
        assertEquals(
            new Expression.Call(null, "bounds", List.of(Expression.nullLiteral())),
            omittedState.state().get("_bounds").initial()
        );
    }

    @Test
    void localActionsAreLoweredUnderTheCallFrame() {
        var toggle = new ComponentDef(
            requiredParams("step"),
            Map.of("value", new StateField("number", 0)),
            List.of(new ActionDefinition("bump", List.of(new ActionStep.Set("value", param("step"))))),
            element("button")
        );

        var lowered = lower(component("Toggle", props("step", lit(5))), Map.of("Toggle", toggle));

        var wrapper = assertInstanceOf(CompiledNode.LocalState.class, lowered);
        assertEquals(0, wrapper.state().get("value").initial());
        assertEquals(List.of(new ActionStep.Set("value", lit(5))), wrapper.actions().get(0).steps());
    }

    @Test
    void componentsWithoutLocalStateAreNotWrapped() {
        var plain = componentDef(Map.of(), element("hr"));

        assertEquals(compiledElement("hr"), lower(component("Plain", Map.of()), Map.of("Plain", plain)));
    }

    @Test
    void slotsOutsideAnyExpansionStayForComposition() {
        var lowered = lower(element("body", slot("nav"), slot()), Map.of());

        assertEquals(compiledElement("body", new CompiledNode.Slot("nav"), new CompiledNode.Slot(null)), lowered);
    }

    @Test
    void loopsLowerTheirBodies() {
        var row = componentDef(requiredParams("item"), element("li", text(param("item", "name"))));
        var view = each(state("users"), "user", component("Row", props("item", variable("user"))));

        var lowered = lower(view, Map.of("Row", row));

        var expected = new CompiledNode.Each(
            state("users"),
            "user",
            null,
            null,
            compiledElement("li", compiledText(new Expression.VarRef("user", "name")))
        );
        assertEquals(expected, lowered);
    }

    @Test
    void nestingPastTheCeilingBecomesPlaceholder() {
        var shallow = new ViewLowerer(expressions, new ActionLowerer(expressions), 2);

        var lowered = shallow.lower(element("a", element("b", element("c"))), LoweringScope.root(Map.of()));

        assertEquals(compiledElement("a", compiledElement("b", ViewLowerer.placeholder())), lowered);
    }

    @Test
    void recursiveComponentsTerminate() {
        var loop = componentDef(Map.of(), element("div", component("Loop", Map.of())));
        var shallow = new ViewLowerer(expressions, new ActionLowerer(expressions), 8);

        var lowered = shallow.lower(component("Loop", Map.of()), LoweringScope.root(Map.of("Loop", loop)));

        assertInstanceOf(CompiledNode.Element.class, lowered);
    }

    @Test
    void expansionDepthIncludesInlinedDefinitions() {
        var components = new LinkedHashMap<String, ComponentDef>();
        components.put("Inner", componentDef(Map.of(), element("div", text("x"))));
        components.put("Outer", componentDef(Map.of(), element("section", component("Inner", Map.of()))));
        var view = element("main", component("Outer", Map.of()));

        var tight = new ViewLowerer(expressions, new ActionLowerer(expressions), 5)
            .lower(view, LoweringScope.root(components));
        var enough = new ViewLowerer(expressions, new ActionLowerer(expressions), 6)
            .lower(view, LoweringScope.root(components));

        assertEquals(
            compiledElement("main", compiledElement("section", compiledElement("div", ViewLowerer.placeholder()))),
            tight
        );
        assertEquals(
            compiledElement("main", compiledElement("section", compiledElement("div", compiledText(lit("x"))))),
            enough
        );
    }
}
