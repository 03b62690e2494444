package work.lcod.ui.lowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.PropValue;

/**
 * Maps source expressions to compiled ones, resolving param refs against the active frame.
 *
 * <ul>
 *   <li>no frame: the param ref is kept as is, it names a layout-level parameter;</li>
 *   <li>unbound name, or a name bound to an event handler: null literal;</li>
 *   <li>bound expression without path: the bound expression;</li>
 *   <li>bound var/state/import/data ref with path: the paths are joined with a dot;</li>
 *   <li>any other bound expression with path: a property get on it.</li>
 * </ul>
 *
 * <p>Stateless and safe to share.</p>
 */
public final class ExpressionLowerer {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionLowerer.class);

    public Expression lower(Expression expr, SubstitutionFrame frame) {
        return expr.accept(new Lowering(frame));
    }

    public Expression lowerOptional(Expression expr, SubstitutionFrame frame) {
        return expr == null ? null : lower(expr, frame);
    }

    public List<Expression> lowerAll(List<Expression> exprs, SubstitutionFrame frame) {
        var lowered = new ArrayList<Expression>(exprs.size());
        for (var expr : exprs) {
            lowered.add(lower(expr, frame));
        }
        return lowered;
    }

    public EventHandler lowerHandler(EventHandler handler, SubstitutionFrame frame) {
        var fields = new LinkedHashMap<String, Expression>();
        for (var entry : handler.payloadFields().entrySet()) {
            fields.put(entry.getKey(), lower(entry.getValue(), frame));
        }
        return handler.withPayload(lowerOptional(handler.payload(), frame), fields);
    }

    /**
     * Lowers a prop value. A bare param ref bound to an event handler yields that handler.
     */
    public PropValue lowerProp(PropValue value, SubstitutionFrame frame) {
        if (value instanceof EventHandler handler) {
            return lowerHandler(handler, frame);
        }
        if (frame != null && value instanceof Expression.ParamRef ref && isBlank(ref.path())
            && frame.params().get(ref.name()) instanceof EventHandler bound) {
            return bound;
        }
        return lower((Expression) value, frame);
    }

    static Expression resolveParam(Expression.ParamRef ref, SubstitutionFrame frame) {
        if (frame == null) {
            return new Expression.ParamRef(ref.name(), ref.path());
        }
        PropValue bound = frame.params().get(ref.name());
        if (bound == null) {
            LOG.debug("Param '{}' has no binding, substituting null", ref.name());
            return Expression.nullLiteral();
        }
        if (!(bound instanceof Expression expr)) {
            LOG.debug("Param '{}' is bound to an event handler in expression position", ref.name());
            return Expression.nullLiteral();
        }
        if (isBlank(ref.path())) {
            return expr;
        }
        String path = ref.path();
        if (expr instanceof Expression.VarRef variable) {
            return new Expression.VarRef(variable.name(), join(variable.path(), path));
        }
        if (expr instanceof Expression.StateRef state) {
            return new Expression.StateRef(state.name(), join(state.path(), path));
        }
        if (expr instanceof Expression.ImportRef imported) {
            return new Expression.ImportRef(imported.name(), join(imported.path(), path));
        }
        if (expr instanceof Expression.DataRef data) {
            return new Expression.DataRef(data.name(), join(data.path(), path));
        }
        return new Expression.PropertyGet(expr, path);
    }

    private static String join(String existing, String extra) {
        return isBlank(existing) ? extra : existing + "." + extra;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    private final class Lowering implements Expression.Visitor<Expression> {
        private final SubstitutionFrame frame;

        private Lowering(SubstitutionFrame frame) {
            this.frame = frame;
        }

        private Expression sub(Expression expr) {
            return expr.accept(this);
        }

        @Override
        public Expression visitLiteral(Expression.Literal expr) {
            return new Expression.Literal(expr.value());
        }

        @Override
        public Expression visitState(Expression.StateRef expr) {
            return new Expression.StateRef(expr.name(), expr.path());
        }

        @Override
        public Expression visitVar(Expression.VarRef expr) {
            return new Expression.VarRef(expr.name(), expr.path());
        }

        @Override
        public Expression visitBinary(Expression.Binary expr) {
            return new Expression.Binary(expr.op(), sub(expr.left()), sub(expr.right()));
        }

        @Override
        public Expression visitNot(Expression.Not expr) {
            return new Expression.Not(sub(expr.operand()));
        }

        @Override
        public Expression visitConditional(Expression.Conditional expr) {
            return new Expression.Conditional(sub(expr.condition()), sub(expr.then()), sub(expr.otherwise()));
        }

        @Override
        public Expression visitGet(Expression.PropertyGet expr) {
            return new Expression.PropertyGet(sub(expr.base()), expr.path());
        }

        @Override
        public Expression visitRoute(Expression.RouteRef expr) {
            return new Expression.RouteRef(expr.name(), expr.source());
        }

        @Override
        public Expression visitImport(Expression.ImportRef expr) {
            return new Expression.ImportRef(expr.name(), expr.path());
        }

        @Override
        public Expression visitData(Expression.DataRef expr) {
            return new Expression.DataRef(expr.name(), expr.path());
        }

        @Override
        public Expression visitRef(Expression.DomRef expr) {
            return new Expression.DomRef(expr.name());
        }

        @Override
        public Expression visitIndex(Expression.IndexGet expr) {
            return new Expression.IndexGet(sub(expr.base()), sub(expr.key()));
        }

        @Override
        public Expression visitParam(Expression.ParamRef expr) {
            return resolveParam(expr, frame);
        }

        @Override
        public Expression visitCall(Expression.Call expr) {
            Expression target = expr.target() == null ? null : sub(expr.target());
            return new Expression.Call(target, expr.method(), lowerAll(expr.args(), frame));
        }

        @Override
        public Expression visitLambda(Expression.Lambda expr) {
            return new Expression.Lambda(expr.param(), expr.index(), sub(expr.body()));
        }

        @Override
        public Expression visitArray(Expression.ArrayLiteral expr) {
            return new Expression.ArrayLiteral(lowerAll(expr.elements(), frame));
        }

        @Override
        public Expression visitConcat(Expression.Concat expr) {
            return new Expression.Concat(lowerAll(expr.items(), frame));
        }
    }
}
