package work.lcod.ui.lowering;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static work.lcod.ui.support.AstFixtures.lit;
import static work.lcod.ui.support.AstFixtures.param;
import static work.lcod.ui.support.AstFixtures.props;
import static work.lcod.ui.support.AstFixtures.state;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;

class ExpressionLowererTest {
    private final ExpressionLowerer lowerer = new ExpressionLowerer();

    private static SubstitutionFrame frame(Object... pairs) {
        return SubstitutionFrame.of(props(pairs));
    }

    @Test
    void keepsParamRefsWithoutFrame() {
        assertEquals(new Expression.ParamRef("title", "text"), lowerer.lower(param("title", "text"), null));
    }

    @Test
    void unboundParamBecomesNull() {
        assertEquals(Expression.nullLiteral(), lowerer.lower(param("missing"), SubstitutionFrame.EMPTY));
    }

    @Test
    void boundParamIsReplacedByItsValue() {
        assertEquals(lit("Hi"), lowerer.lower(param("title"), frame("title", lit("Hi"))));
    }

    @Test
    void pathsAreJoinedOntoReferences() {
        var onVar = frame("item", new Expression.VarRef("row"));
        var onNestedState = frame("item", new Expression.StateRef("user", "profile"));
        var onImport = frame("item", new Expression.ImportRef("posts", null));
        var onData = frame("item", new Expression.DataRef("feed", "0"));

        assertEquals(new Expression.VarRef("row", "name"), lowerer.lower(param("item", "name"), onVar));
        assertEquals(new Expression.StateRef("user", "profile.name"), lowerer.lower(param("item", "name"), onNestedState));
        assertEquals(new Expression.ImportRef("posts", "name"), lowerer.lower(param("item", "name"), onImport));
        assertEquals(new Expression.DataRef("feed", "0.name"), lowerer.lower(param("item", "name"), onData));
    }

    @Test
    void pathOnOtherExpressionsBecomesPropertyGet() {
        var bound = lit(Map.of("name", "Ada"));

        var lowered = lowerer.lower(param("user", "name"), frame("user", bound));

        assertEquals(new Expression.PropertyGet(bound, "name"), lowered);
    }

    @Test
    void handlerInExpressionPositionBecomesNull() {
        var handler = EventHandler.of("click", "save");
        var bound = frame("onPick", handler);

        assertEquals(Expression.nullLiteral(), lowerer.lower(param("onPick"), bound));
        assertEquals(Expression.nullLiteral(), lowerer.lower(param("onPick", "action"), bound));
        assertSame(handler, lowerer.lowerProp(param("onPick"), bound));
    }

    @Test
    void substitutesInsideNestedExpressions() {
        var source = new Expression.Binary(
            "+",
            param("a"),
            new Expression.Call(null, "max", List.of(param("b"), state("floor")))
        );

        var lowered = lowerer.lower(source, frame("a", lit(1), "b", lit(2)));

        var expected = new Expression.Binary(
            "+",
            lit(1),
            new Expression.Call(null, "max", List.of(lit(2), state("floor")))
        );
        assertEquals(expected, lowered);
    }

    @Test
    void specializesCallArgumentsPerBinding() {
        var source = new Expression.Call(null, "bounds", List.of(param("data")));

        var bound = lowerer.lower(source, frame("data", lit(List.of(1, 2, 3))));
        var omitted = lowerer.lower(source, SubstitutionFrame.EMPTY);

        assertEquals(new Expression.Call(null, "bounds", List.of(lit(List.of(1, 2, 3)))), bound);
        assertEquals(new Expression.Call(null, "bounds", List.of(Expression.nullLiteral())), omitted);
    }

    @Test
    void lowersHandlerPayloads() {
        var handler = new EventHandler("click", "select", param("id"), Map.of("at", param("when")), 100, null, Map.of());

        var lowered = lowerer.lowerHandler(handler, frame("id", lit(3), "when", state("now")));

        assertEquals(lit(3), lowered.payload());
        assertEquals(state("now"), lowered.payloadFields().get("at"));
        assertEquals(100, lowered.debounce());
        assertEquals("select", lowered.action());
    }

    @Test
    void lambdaBodiesAreLowered() {
        var source = new Expression.Lambda("x", null, new Expression.Binary("*", new Expression.VarRef("x"), param("factor")));

        var lowered = lowerer.lower(source, frame("factor", lit(10)));

        assertEquals(new Expression.Lambda("x", null, new Expression.Binary("*", new Expression.VarRef("x"), lit(10))), lowered);
    }
}
