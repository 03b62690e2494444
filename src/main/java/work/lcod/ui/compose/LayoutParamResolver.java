package work.lcod.ui.compose;

import java.util.List;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.compiled.CompiledTreeRewriter;
import work.lcod.ui.lowering.ActionLowerer;
import work.lcod.ui.lowering.ExpressionLowerer;
import work.lcod.ui.lowering.SubstitutionFrame;

/**
 * Resolves the layout-level param refs left in a lowered tree against the page's layout params. Every
 * expression of the tree is visited, including handler payloads, local and island state, and their actions.
 */
final class LayoutParamResolver extends CompiledTreeRewriter {
    private final ExpressionLowerer expressions;
    private final ActionLowerer actions;
    private final SubstitutionFrame frame;

    LayoutParamResolver(ExpressionLowerer expressions, ActionLowerer actions, SubstitutionFrame frame) {
        this.expressions = expressions;
        this.actions = actions;
        this.frame = frame;
    }

    @Override
    protected Expression expression(Expression expr) {
        return expressions.lower(expr, frame);
    }

    @Override
    protected List<ActionDefinition> actions(List<ActionDefinition> definitions) {
        return actions.lowerAll(definitions, frame);
    }
}
