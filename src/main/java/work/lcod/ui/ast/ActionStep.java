package work.lcod.ui.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of an action, tagged by {@code do} on the wire.
 *
 * <p>Nullable components are optional members. Nested step lists are never null. {@link Unknown} keeps steps
 * the reader does not recognise; {@link NoOp} is what the lowerer turns them into.</p>
 */
public sealed interface ActionStep {

    <R> R accept(Visitor<R> visitor);

    String tag();

    record Set(String target, Expression value) implements ActionStep {
        public Set {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }

        @Override
        public String tag() {
            return "set";
        }
    }

    record Update(
        String target,
        String operation,
        Expression value,
        Expression index,
        Expression deleteCount
    ) implements ActionStep {
        public Update {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(operation, "operation");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUpdate(this);
        }

        @Override
        public String tag() {
            return "update";
        }
    }

    record SetPath(String target, Expression path, Expression value) implements ActionStep {
        public SetPath {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetPath(this);
        }

        @Override
        public String tag() {
            return "setPath";
        }
    }

    record Fetch(
        Expression url,
        String method,
        Expression body,
        String result,
        List<ActionStep> onSuccess,
        List<ActionStep> onError
    ) implements ActionStep {
        public Fetch {
            Objects.requireNonNull(url, "url");
            onSuccess = JsonValues.listCopy(onSuccess);
            onError = JsonValues.listCopy(onError);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFetch(this);
        }

        @Override
        public String tag() {
            return "fetch";
        }
    }

    record Storage(
        String operation,
        Expression key,
        String storage,
        Expression value,
        String result,
        List<ActionStep> onSuccess,
        List<ActionStep> onError
    ) implements ActionStep {
        public Storage {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(key, "key");
            onSuccess = JsonValues.listCopy(onSuccess);
            onError = JsonValues.listCopy(onError);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStorage(this);
        }

        @Override
        public String tag() {
            return "storage";
        }
    }

    record Clipboard(
        String operation,
        Expression value,
        String result,
        List<ActionStep> onSuccess,
        List<ActionStep> onError
    ) implements ActionStep {
        public Clipboard {
            Objects.requireNonNull(operation, "operation");
            onSuccess = JsonValues.listCopy(onSuccess);
            onError = JsonValues.listCopy(onError);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClipboard(this);
        }

        @Override
        public String tag() {
            return "clipboard";
        }
    }

    record Navigate(Expression url, String target, Boolean replace) implements ActionStep {
        public Navigate {
            Objects.requireNonNull(url, "url");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNavigate(this);
        }

        @Override
        public String tag() {
            return "navigate";
        }
    }

    record Import(String module, String result, List<ActionStep> onSuccess, List<ActionStep> onError)
        implements ActionStep {
        public Import {
            Objects.requireNonNull(module, "module");
            onSuccess = JsonValues.listCopy(onSuccess);
            onError = JsonValues.listCopy(onError);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }

        @Override
        public String tag() {
            return "import";
        }
    }

    record Call(
        Expression target,
        List<Expression> args,
        String result,
        List<ActionStep> onSuccess,
        List<ActionStep> onError
    ) implements ActionStep {
        public Call {
            Objects.requireNonNull(target, "target");
            args = JsonValues.listCopy(args);
            onSuccess = JsonValues.listCopy(onSuccess);
            onError = JsonValues.listCopy(onError);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String tag() {
            return "call";
        }
    }

    record Subscribe(Expression target, String event, String action) implements ActionStep {
        public Subscribe {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(event, "event");
            Objects.requireNonNull(action, "action");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscribe(this);
        }

        @Override
        public String tag() {
            return "subscribe";
        }
    }

    record Dispose(Expression target) implements ActionStep {
        public Dispose {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDispose(this);
        }

        @Override
        public String tag() {
            return "dispose";
        }
    }

    record Dom(String operation, Expression selector, Expression value, String attribute) implements ActionStep {
        public Dom {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(selector, "selector");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDom(this);
        }

        @Override
        public String tag() {
            return "dom";
        }
    }

    /** Conditional branch; written with {@code condition}/{@code then}/{@code else}. */
    record If(Expression condition, List<ActionStep> then, List<ActionStep> otherwise) implements ActionStep {
        public If {
            Objects.requireNonNull(condition, "condition");
            then = JsonValues.listCopy(then);
            otherwise = JsonValues.listCopy(otherwise);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public String tag() {
            return "if";
        }
    }

    record Delay(Expression ms, List<ActionStep> then, String result) implements ActionStep {
        public Delay {
            Objects.requireNonNull(ms, "ms");
            then = JsonValues.listCopy(then);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelay(this);
        }

        @Override
        public String tag() {
            return "delay";
        }
    }

    record Interval(Expression ms, String action, String result) implements ActionStep {
        public Interval {
            Objects.requireNonNull(ms, "ms");
            Objects.requireNonNull(action, "action");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInterval(this);
        }

        @Override
        public String tag() {
            return "interval";
        }
    }

    record ClearTimer(Expression target) implements ActionStep {
        public ClearTimer {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClearTimer(this);
        }

        @Override
        public String tag() {
            return "clearTimer";
        }
    }

    record Focus(Expression target, String operation, List<ActionStep> onSuccess, List<ActionStep> onError)
        implements ActionStep {
        public Focus {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(operation, "operation");
            onSuccess = JsonValues.listCopy(onSuccess);
            onError = JsonValues.listCopy(onError);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFocus(this);
        }

        @Override
        public String tag() {
            return "focus";
        }
    }

    /** A step whose tag is not part of the closed set; {@code raw} holds the members as read. */
    record Unknown(String tag, Map<String, Object> raw) implements ActionStep {
        public Unknown {
            Objects.requireNonNull(tag, "tag");
            raw = JsonValues.immutableObject(raw);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnknown(this);
        }
    }

    record NoOp() implements ActionStep {
        public static final NoOp INSTANCE = new NoOp();

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNoOp(this);
        }

        @Override
        public String tag() {
            return "noop";
        }
    }

    interface Visitor<R> {
        R visitSet(Set step);

        R visitUpdate(Update step);

        R visitSetPath(SetPath step);

        R visitFetch(Fetch step);

        R visitStorage(Storage step);

        R visitClipboard(Clipboard step);

        R visitNavigate(Navigate step);

        R visitImport(Import step);

        R visitCall(Call step);

        R visitSubscribe(Subscribe step);

        R visitDispose(Dispose step);

        R visitDom(Dom step);

        R visitIf(If step);

        R visitDelay(Delay step);

        R visitInterval(Interval step);

        R visitClearTimer(ClearTimer step);

        R visitFocus(Focus step);

        R visitUnknown(Unknown step);

        R visitNoOp(NoOp step);
    }
}
