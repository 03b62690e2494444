package work.lcod.ui.compiled;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.StateField;

/**
 * Rebuilds a compiled tree node by node. Every node of the result is a fresh instance; expressions, handlers,
 * actions and slots go through overridable hooks that default to identity.
 */
public class CompiledTreeRewriter implements CompiledNode.Visitor<CompiledNode> {

    public CompiledNode rewrite(CompiledNode node) {
        return node == null ? null : node.accept(this);
    }

    protected Expression expression(Expression expr) {
        return expr;
    }

    protected List<ActionDefinition> actions(List<ActionDefinition> actions) {
        return actions;
    }

    protected CompiledNode slot(CompiledNode.Slot slot) {
        return new CompiledNode.Slot(slot.name());
    }

    protected EventHandler handler(EventHandler handler) {
        var fields = new LinkedHashMap<String, Expression>();
        for (var entry : handler.payloadFields().entrySet()) {
            fields.put(entry.getKey(), expression(entry.getValue()));
        }
        Expression payload = handler.payload() == null ? null : expression(handler.payload());
        return handler.withPayload(payload, fields);
    }

    protected PropValue prop(PropValue value) {
        if (value instanceof EventHandler handler) {
            return handler(handler);
        }
        return expression((Expression) value);
    }

    protected StateField stateField(StateField field) {
        if (field.initial() instanceof Expression initial) {
            return new StateField(field.type(), expression(initial));
        }
        return new StateField(field.type(), field.initial());
    }

    protected final Map<String, StateField> state(Map<String, StateField> state) {
        var result = new LinkedHashMap<String, StateField>();
        for (var entry : state.entrySet()) {
            result.put(entry.getKey(), stateField(entry.getValue()));
        }
        return result;
    }

    protected final List<CompiledNode> children(List<CompiledNode> children) {
        var result = new ArrayList<CompiledNode>(children.size());
        for (var child : children) {
            result.add(rewrite(child));
        }
        return result;
    }

    private Expression optional(Expression expr) {
        return expr == null ? null : expression(expr);
    }

    @Override
    public CompiledNode visitElement(CompiledNode.Element node) {
        var props = new LinkedHashMap<String, PropValue>();
        for (var entry : node.props().entrySet()) {
            props.put(entry.getKey(), prop(entry.getValue()));
        }
        return new CompiledNode.Element(node.tag(), node.ref(), props, children(node.children()));
    }

    @Override
    public CompiledNode visitText(CompiledNode.Text node) {
        return new CompiledNode.Text(expression(node.value()));
    }

    @Override
    public CompiledNode visitIf(CompiledNode.If node) {
        return new CompiledNode.If(expression(node.condition()), rewrite(node.then()), rewrite(node.otherwise()));
    }

    @Override
    public CompiledNode visitEach(CompiledNode.Each node) {
        return new CompiledNode.Each(
            expression(node.items()),
            node.as(),
            node.index(),
            optional(node.key()),
            rewrite(node.body())
        );
    }

    @Override
    public CompiledNode visitMarkdown(CompiledNode.Markdown node) {
        return new CompiledNode.Markdown(expression(node.content()));
    }

    @Override
    public CompiledNode visitCode(CompiledNode.Code node) {
        return new CompiledNode.Code(expression(node.language()), expression(node.content()));
    }

    @Override
    public CompiledNode visitSlot(CompiledNode.Slot node) {
        return slot(node);
    }

    @Override
    public CompiledNode visitPortal(CompiledNode.Portal node) {
        return new CompiledNode.Portal(node.target(), children(node.children()));
    }

    @Override
    public CompiledNode visitLocalState(CompiledNode.LocalState node) {
        return new CompiledNode.LocalState(state(node.state()), actions(node.actions()), rewrite(node.child()));
    }

    @Override
    public CompiledNode visitIsland(CompiledNode.Island node) {
        return new CompiledNode.Island(
            node.id(),
            node.strategy(),
            node.strategyOptions(),
            rewrite(node.content()),
            state(node.state()),
            actions(node.actions())
        );
    }

    @Override
    public CompiledNode visitSuspense(CompiledNode.Suspense node) {
        return new CompiledNode.Suspense(node.id(), rewrite(node.fallback()), rewrite(node.content()));
    }

    @Override
    public CompiledNode visitErrorBoundary(CompiledNode.ErrorBoundary node) {
        return new CompiledNode.ErrorBoundary(rewrite(node.fallback()), rewrite(node.content()));
    }
}
