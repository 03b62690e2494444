package work.lcod.ui.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Source view tree, tagged by {@code kind} on the wire.
 */
public sealed interface ViewNode {

    <R> R accept(Visitor<R> visitor);

    String kind();

    record Element(String tag, String ref, Map<String, PropValue> props, List<ViewNode> children)
        implements ViewNode {
        public Element {
            Objects.requireNonNull(tag, "tag");
            props = JsonValues.orderedCopy(props);
            children = JsonValues.listCopy(children);
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

    record Text(Expression value) implements ViewNode {
        public Text {
            Objects.requireNonNull(value, "value");
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

    record If(Expression condition, ViewNode then, ViewNode otherwise) implements ViewNode {
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

    record Each(Expression items, String as, String index, Expression key, ViewNode body) implements ViewNode {
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

    record Component(String name, Map<String, PropValue> props, List<ViewNode> children) implements ViewNode {
        public Component {
            Objects.requireNonNull(name, "name");
            props = JsonValues.orderedCopy(props);
            children = JsonValues.listCopy(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComponent(this);
        }

        @Override
        public String kind() {
            return "component";
        }
    }

    /** Insertion point; a null name is the default slot. */
    record Slot(String name) implements ViewNode {
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

    record Markdown(Expression content) implements ViewNode {
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

    record Code(Expression language, Expression content) implements ViewNode {
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

    record Portal(String target, List<ViewNode> children) implements ViewNode {
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

    record Island(
        String id,
        String strategy,
        Map<String, Object> strategyOptions,
        ViewNode content,
        Map<String, StateField> state,
        List<ActionDefinition> actions
    ) implements ViewNode {
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

    record Suspense(String id, ViewNode fallback, ViewNode content) implements ViewNode {
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

    record ErrorBoundary(ViewNode fallback, ViewNode content) implements ViewNode {
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

        R visitComponent(Component node);

        R visitSlot(Slot node);

        R visitMarkdown(Markdown node);

        R visitCode(Code node);

        R visitPortal(Portal node);

        R visitIsland(Island node);

        R visitSuspense(Suspense node);

        R visitErrorBoundary(ErrorBoundary node);
    }
}
