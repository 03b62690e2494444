package work.lcod.ui.compiled;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.JsonValues;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.StateField;

/**
 * Lowered view tree. There is no component kind: components are inlined, and their private state is
 * attached through {@link LocalState} wrappers.
 */
public sealed interface CompiledNode {

    <R> R accept(Visitor<R> visitor);

    String kind();

    record Element(String tag, String ref, Map<String, PropValue> props, List<CompiledNode> children)
        implements CompiledNode {
        public Element {
            Objects.requireNonNull(tag, "tag");
            props = JsonValues.orderedCopy(props);
            children = JsonValues.listCopy(children);
        }

        public static Element empty(String tag) {
            return new Element(tag, null, Map.of(), List.of());
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitElement(this);
        }

        @Override
        public String kind() {
            return "element";
        }
    }

    record Text(Expression value) implements CompiledNode {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        public static Text empty() {
            return new Text(Expression.literal(""));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(this);
        }

        @Override
        public String kind() {
            return "text";
        }
    }

    record If(Expression condition, CompiledNode then, CompiledNode otherwise) implements CompiledNode {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public String kind() {
            return "if";
        }
    }

    record Each(Expression items, String as, String index, Expression key, CompiledNode body)
        implements CompiledNode {
        public Each {
            Objects.requireNonNull(items, "items");
            Objects.requireNonNull(as, "as");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEach(this);
        }

        @Override
        public String kind() {
            return "each";
        }
    }

    record Markdown(Expression content) implements CompiledNode {
        public Markdown {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMarkdown(this);
        }

        @Override
        public String kind() {
            return "markdown";
        }
    }

    record Code(Expression language, Expression content) implements CompiledNode {
        public Code {
            Objects.requireNonNull(language, "language");
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCode(this);
        }

        @Override
        public String kind() {
            return "code";
        }
    }

    /** Layout insertion point still waiting for composition. */
    record Slot(String name) implements CompiledNode {
        public boolean isDefault() {
            return name == null || name.isEmpty();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSlot(this);
        }

        @Override
        public String kind() {
            return "slot";
        }
    }

    record Portal(String target, List<CompiledNode> children) implements CompiledNode {
        public Portal {
            Objects.requireNonNull(target, "target");
            children = JsonValues.listCopy(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPortal(this);
        }

        @Override
        public String kind() {
            return "portal";
        }
    }

    /** State and actions private to one component expansion. */
    record LocalState(Map<String, StateField> state, List<ActionDefinition> actions, CompiledNode child)
        implements CompiledNode {
        public LocalState {
            Objects.requireNonNull(child, "child");
            state = JsonValues.orderedCopy(state);
            actions = JsonValues.listCopy(actions);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLocalState(this);
        }

        @Override
        public String kind() {
            return "localState";
        }
    }

    record Island(
        String id,
        String strategy,
        Map<String, Object> strategyOptions,
        CompiledNode content,
        Map<String, StateField> state,
        List<ActionDefinition> actions
    ) implements CompiledNode {
        public Island {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(strategy, "strategy");
            Objects.requireNonNull(content, "content");
            strategyOptions = JsonValues.immutableObject(strategyOptions);
            state = JsonValues.orderedCopy(state);
            actions = JsonValues.listCopy(actions);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIsland(this);
        }

        @Override
        public String kind() {
            return "island";
        }
    }

    record Suspense(String id, CompiledNode fallback, CompiledNode content) implements CompiledNode {
        public Suspense {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(fallback, "fallback");
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSuspense(this);
        }

        @Override
        public String kind() {
            return "suspense";
        }
    }

    record ErrorBoundary(CompiledNode fallback, CompiledNode content) implements CompiledNode {
        public ErrorBoundary {
            Objects.requireNonNull(fallback, "fallback");
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitErrorBoundary(this);
        }

        @Override
        public String kind() {
            return "errorBoundary";
        }
    }

    interface Visitor<R> {
        R visitElement(Element node);

        R visitText(Text node);

        R visitIf(If node);

        R visitEach(Each node);

        R visitMarkdown(Markdown node);

        R visitCode(Code node);

        R visitSlot(Slot node);

        R visitPortal(Portal node);

        R visitLocalState(LocalState node);

        R visitIsland(Island node);

        R visitSuspense(Suspense node);

        R visitErrorBoundary(ErrorBoundary node);
    }
}
