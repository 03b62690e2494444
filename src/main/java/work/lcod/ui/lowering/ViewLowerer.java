package work.lcod.ui.lowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;
import work.lcod.ui.compiled.CompiledNode;
import work.lcod.ui.compiled.CompiledTrees;

/**
 * Lowers source view nodes and inlines component calls.
 *
 * <p>A component call lowers its props and children under the caller's frame, then lowers the definition view
 * under a fresh frame built from them. Nothing of the caller's frame is visible inside the definition.
 * Unknown components and nesting past {@code maxDepth} degrade to an empty {@code div}.</p>
 */
public final class ViewLowerer {
    public static final String PLACEHOLDER_TAG = "div";
    public static final String SLOT_WRAPPER_TAG = "span";

    private static final Logger LOG = LoggerFactory.getLogger(ViewLowerer.class);

    private final ExpressionLowerer expressions;
    private final ActionLowerer actions;
    private final int maxDepth;

    public ViewLowerer(ExpressionLowerer expressions, ActionLowerer actions, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.expressions = expressions;
        this.actions = actions;
        this.maxDepth = maxDepth;
    }

    public CompiledNode lower(ViewNode node, LoweringScope scope) {
        if (scope.depth() > maxDepth) {
            LOG.warn("View nesting exceeds {} levels at {} node, emitting placeholder", maxDepth, node.kind());
            return placeholder();
        }
        return node.accept(new NodeLowering(scope));
    }

    public static CompiledNode placeholder() {
        return CompiledNode.Element.empty(PLACEHOLDER_TAG);
    }

    /**
     * Content for a slot of the current expansion: empty text, the single child, or a span around all of them.
     */
    static CompiledNode slotContent(List<CompiledNode> content) {
        if (content.isEmpty()) {
            return CompiledNode.Text.empty();
        }
        if (content.size() == 1) {
            return CompiledTrees.copy(content.get(0));
        }
        var copies = new ArrayList<CompiledNode>(content.size());
        for (var child : content) {
            copies.add(CompiledTrees.copy(child));
        }
        return new CompiledNode.Element(SLOT_WRAPPER_TAG, null, Map.of(), copies);
    }

    private Map<String, StateField> lowerState(Map<String, StateField> state, SubstitutionFrame frame) {
        var lowered = new LinkedHashMap<String, StateField>();
        for (var entry : state.entrySet()) {
            var field = entry.getValue();
            if (field.initial() instanceof Expression initial) {
                lowered.put(entry.getKey(), new StateField(field.type(), expressions.lower(initial, frame)));
            } else {
                lowered.put(entry.getKey(), field);
            }
        }
        return lowered;
    }

    private Map<String, PropValue> lowerProps(Map<String, PropValue> props, SubstitutionFrame frame) {
        var lowered = new LinkedHashMap<String, PropValue>();
        for (var entry : props.entrySet()) {
            lowered.put(entry.getKey(), expressions.lowerProp(entry.getValue(), frame));
        }
        return lowered;
    }

    private List<CompiledNode> lowerChildren(List<ViewNode> children, LoweringScope scope) {
        var next = scope.descend();
        var lowered = new ArrayList<CompiledNode>(children.size());
        for (var child : children) {
            lowered.add(lower(child, next));
        }
        return lowered;
    }

    private CompiledNode inline(ViewNode.Component call, LoweringScope scope) {
        ComponentDef definition = scope.components().get(call.name());
        if (definition == null) {
            LOG.debug("Component '{}' is not defined, emitting placeholder", call.name());
            return placeholder();
        }
        var frame = new SubstitutionFrame(
            lowerProps(call.props(), scope.frame()),
            lowerChildren(call.children(), scope)
        );
        var expanded = lower(definition.view(), scope.enter(frame));
        if (!definition.hasLocalState() && definition.localActions().isEmpty()) {
            return expanded;
        }
        return new CompiledNode.LocalState(
            lowerState(definition.localState(), frame),
            actions.lowerAll(definition.localActions(), frame),
            expanded
        );
    }

    private final class NodeLowering implements ViewNode.Visitor<CompiledNode> {
        private final LoweringScope scope;
        private final SubstitutionFrame frame;

        private NodeLowering(LoweringScope scope) {
            this.scope = scope;
            this.frame = scope.frame();
        }

        private Expression expr(Expression expr) {
            return expressions.lowerOptional(expr, frame);
        }

        private CompiledNode child(ViewNode node) {
            return node == null ? null : lower(node, scope.descend());
        }

        @Override
        public CompiledNode visitElement(ViewNode.Element node) {
            return new CompiledNode.Element(
                node.tag(),
                node.ref(),
                lowerProps(node.props(), frame),
                lowerChildren(node.children(), scope)
            );
        }

        @Override
        public CompiledNode visitText(ViewNode.Text node) {
            return new CompiledNode.Text(expr(node.value()));
        }

        @Override
        public CompiledNode visitIf(ViewNode.If node) {
            return new CompiledNode.If(expr(node.condition()), child(node.then()), child(node.otherwise()));
        }

        @Override
        public CompiledNode visitEach(ViewNode.Each node) {
            return new CompiledNode.Each(
                expr(node.items()),
                node.as(),
                node.index(),
                expr(node.key()),
                child(node.body())
            );
        }

        @Override
        public CompiledNode visitComponent(ViewNode.Component node) {
            return inline(node, scope);
        }

        @Override
        public CompiledNode visitSlot(ViewNode.Slot node) {
            if (frame == null) {
                return new CompiledNode.Slot(node.name());
            }
            return slotContent(frame.slotContent());
        }

        @Override
        public CompiledNode visitMarkdown(ViewNode.Markdown node) {
            return new CompiledNode.Markdown(expr(node.content()));
        }

        @Override
        public CompiledNode visitCode(ViewNode.Code node) {
            return new CompiledNode.Code(expr(node.language()), expr(node.content()));
        }

        @Override
        public CompiledNode visitPortal(ViewNode.Portal node) {
            return new CompiledNode.Portal(node.target(), lowerChildren(node.children(), scope));
        }

        @Override
        public CompiledNode visitIsland(ViewNode.Island node) {
            return new CompiledNode.Island(
                node.id(),
                node.strategy(),
                node.strategyOptions(),
                child(node.content()),
                lowerState(node.state(), frame),
                actions.lowerAll(node.actions(), frame)
            );
        }

        @Override
        public CompiledNode visitSuspense(ViewNode.Suspense node) {
            return new CompiledNode.Suspense(node.id(), child(node.fallback()), child(node.content()));
        }

        @Override
        public CompiledNode visitErrorBoundary(ViewNode.ErrorBoundary node) {
            return new CompiledNode.ErrorBoundary(child(node.fallback()), child(node.content()));
        }
    }
}
