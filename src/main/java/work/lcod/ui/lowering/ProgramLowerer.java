package work.lcod.ui.lowering;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.ast.Program;
import work.lcod.ui.ast.RouteDefinition;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.compiled.CompiledLayoutProgram;
import work.lcod.ui.compiled.CompiledProgram;
import work.lcod.ui.compiled.CompiledRoute;

/**
 * Lowers whole programs: state, actions, route and the view, which is lowered without an active frame.
 */
public final class ProgramLowerer {
    private final ExpressionLowerer expressions;
    private final ActionLowerer actions;
    private final ViewLowerer views;

    public ProgramLowerer(int maxDepth) {
        this.expressions = new ExpressionLowerer();
        this.actions = new ActionLowerer(expressions);
        this.views = new ViewLowerer(expressions, actions, maxDepth);
    }

    public ExpressionLowerer expressions() {
        return expressions;
    }

    public ActionLowerer actions() {
        return actions;
    }

    public ViewLowerer views() {
        return views;
    }

    public CompiledProgram lowerPage(Program program) {
        var actionMap = new LinkedHashMap<String, ActionDefinition>();
        for (var action : actions.lowerAll(program.actions(), null)) {
            actionMap.put(action.name(), action);
        }
        return new CompiledProgram(
            program.version(),
            lowerRoute(program.route()),
            program.lifecycle(),
            lowerState(program.state()),
            actionMap,
            views.lower(program.view(), LoweringScope.root(program.components())),
            program.importData(),
            program.components()
        );
    }

    public CompiledLayoutProgram lowerLayout(LayoutProgram layout) {
        return new CompiledLayoutProgram(
            layout.version(),
            lowerState(layout.state()),
            actions.lowerAll(layout.actions(), null),
            views.lower(layout.view(), LoweringScope.root(layout.components())),
            layout.components(),
            layout.importData()
        );
    }

    private Map<String, StateField> lowerState(Map<String, StateField> state) {
        var lowered = new LinkedHashMap<String, StateField>();
        for (var entry : state.entrySet()) {
            var field = entry.getValue();
            if (field.initial() instanceof Expression initial) {
                lowered.put(entry.getKey(), new StateField(field.type(), expressions.lower(initial, null)));
            } else {
                lowered.put(entry.getKey(), field);
            }
        }
        return lowered;
    }

    private CompiledRoute lowerRoute(RouteDefinition route) {
        if (route == null) {
            return null;
        }
        var meta = new LinkedHashMap<String, Expression>();
        for (var entry : route.meta().entrySet()) {
            meta.put(entry.getKey(), expressions.lower(entry.getValue(), null));
        }
        return new CompiledRoute(
            route.path(),
            route.pathParams(),
            expressions.lowerOptional(route.title(), null),
            route.layout(),
            route.layoutParams(),
            meta,
            expressions.lowerOptional(route.canonical(), null)
        );
    }
}
