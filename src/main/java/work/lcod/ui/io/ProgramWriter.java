package work.lcod.ui.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.LifecycleHooks;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;
import work.lcod.ui.compiled.CompiledLayoutProgram;
import work.lcod.ui.compiled.CompiledNode;
import work.lcod.ui.compiled.CompiledProgram;
import work.lcod.ui.compiled.CompiledRoute;

/**
 * Serializes compiled programs back into the wire shapes read by {@link AstMapper}.
 *
 * <p>Optional members are omitted when absent, except literal values which are always written.</p>
 */
public final class ProgramWriter {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private static final ExpressionWriter EXPRESSIONS = new ExpressionWriter();
    private static final StepWriter STEPS = new StepWriter();
    private static final ViewWriter VIEWS = new ViewWriter();
    private static final CompiledWriter COMPILED = new CompiledWriter();

    private ProgramWriter() {}

    public static Map<String, Object> toMap(CompiledProgram program) {
        var map = new LinkedHashMap<String, Object>();
        map.put("version", program.version());
        putIfNotNull(map, "route", route(program.route()));
        putIfNotNull(map, "lifecycle", lifecycle(program.lifecycle()));
        map.put("state", state(program.state()));
        map.put("actions", actions(program.actions().values()));
        map.put("view", node(program.view()));
        map.put("importData", program.importData());
        map.put("components", components(program.components()));
        return map;
    }

    public static Map<String, Object> toMap(CompiledLayoutProgram layout) {
        var map = new LinkedHashMap<String, Object>();
        map.put("version", layout.version());
        map.put("type", layout.type());
        map.put("state", state(layout.state()));
        map.put("actions", actions(layout.actions()));
        map.put("view", node(layout.view()));
        map.put("importData", layout.importData());
        map.put("components", components(layout.components()));
        return map;
    }

    public static String toJson(CompiledProgram program) {
        return writeJson(toMap(program));
    }

    public static String toJson(CompiledLayoutProgram layout) {
        return writeJson(toMap(layout));
    }

    public static String writeJson(Object value) {
        try {
            return WRITER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize compiled program", ex);
        }
    }

    public static void write(Path path, String json) {
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, json + System.lineSeparator());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write output: " + path, ex);
        }
    }

    public static Map<String, Object> expression(Expression expression) {
        return expression.accept(EXPRESSIONS);
    }

    public static Map<String, Object> step(ActionStep step) {
        return step.accept(STEPS);
    }

    public static Map<String, Object> node(CompiledNode node) {
        return node.accept(COMPILED);
    }

    public static Map<String, Object> view(ViewNode node) {
        return node.accept(VIEWS);
    }

    // ---------------------------------------------------------------- program parts

    private static Map<String, Object> route(CompiledRoute route) {
        if (route == null) {
            return null;
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("path", route.path());
        map.put("params", route.params());
        putExpression(map, "title", route.title());
        putIfNotNull(map, "layout", route.layout());
        if (!route.layoutParams().isEmpty()) {
            map.put("layoutParams", expressionMap(route.layoutParams()));
        }
        if (!route.meta().isEmpty()) {
            map.put("meta", expressionMap(route.meta()));
        }
        putExpression(map, "canonical", route.canonical());
        return map;
    }

    private static Map<String, Object> lifecycle(LifecycleHooks hooks) {
        return hooks == null ? null : new LinkedHashMap<String, Object>(hooks.declared());
    }

    private static Map<String, Object> components(Map<String, ComponentDef> components) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : components.entrySet()) {
            var definition = entry.getValue();
            var component = new LinkedHashMap<String, Object>();
            var params = new LinkedHashMap<String, Object>();
            for (var param : definition.params().entrySet()) {
                params.put(param.getKey(), Map.of("type", param.getValue().type(), "required", param.getValue().required()));
            }
            component.put("params", params);
            if (!definition.localState().isEmpty()) {
                component.put("localState", state(definition.localState()));
            }
            if (!definition.localActions().isEmpty()) {
                component.put("localActions", actions(definition.localActions()));
            }
            component.put("view", view(definition.view()));
            map.put(entry.getKey(), component);
        }
        return map;
    }

    private static Map<String, Object> state(Map<String, StateField> state) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : state.entrySet()) {
            var field = new LinkedHashMap<String, Object>();
            field.put("type", entry.getValue().type());
            Object initial = entry.getValue().initial();
            field.put("initial", initial instanceof Expression expr ? expression(expr) : initial);
            map.put(entry.getKey(), field);
        }
        return map;
    }

    private static List<Object> actions(Collection<ActionDefinition> actions) {
        var list = new ArrayList<Object>(actions.size());
        for (var action : actions) {
            var map = new LinkedHashMap<String, Object>();
            map.put("name", action.name());
            map.put("steps", steps(action.steps()));
            list.add(map);
        }
        return list;
    }

    private static List<Object> steps(List<ActionStep> steps) {
        var list = new ArrayList<Object>(steps.size());
        for (var step : steps) {
            list.add(step(step));
        }
        return list;
    }

    private static Map<String, Object> props(Map<String, PropValue> props) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : props.entrySet()) {
            map.put(entry.getKey(), prop(entry.getValue()));
        }
        return map;
    }

    private static Map<String, Object> prop(PropValue value) {
        if (value instanceof EventHandler handler) {
            return handler(handler);
        }
        return expression((Expression) value);
    }

    private static Map<String, Object> handler(EventHandler handler) {
        var map = new LinkedHashMap<String, Object>();
        map.put("event", handler.event());
        map.put("action", handler.action());
        if (handler.payload() != null) {
            map.put("payload", expression(handler.payload()));
        } else if (!handler.payloadFields().isEmpty()) {
            map.put("payload", expressionMap(handler.payloadFields()));
        }
        putIfNotNull(map, "debounce", handler.debounce());
        putIfNotNull(map, "throttle", handler.throttle());
        if (!handler.options().isEmpty()) {
            map.put("options", handler.options());
        }
        return map;
    }

    private static List<Object> expressions(List<Expression> expressions) {
        var list = new ArrayList<Object>(expressions.size());
        for (var expr : expressions) {
            list.add(expression(expr));
        }
        return list;
    }

    private static Map<String, Object> expressionMap(Map<String, Expression> expressions) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : expressions.entrySet()) {
            map.put(entry.getKey(), expression(entry.getValue()));
        }
        return map;
    }

    private static void putExpression(Map<String, Object> map, String key, Expression value) {
        if (value != null) {
            map.put(key, expression(value));
        }
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static Map<String, Object> tagged(String member, String tag) {
        var map = new LinkedHashMap<String, Object>();
        map.put(member, tag);
        return map;
    }

    // ---------------------------------------------------------------- visitors

    private static final class ExpressionWriter implements Expression.Visitor<Map<String, Object>> {
        private static Map<String, Object> start(Expression expr) {
            return tagged("expr", expr.tag());
        }

        private static Map<String, Object> named(Expression expr, String name, String path) {
            var map = start(expr);
            map.put("name", name);
            putIfNotNull(map, "path", path);
            return map;
        }

        @Override
        public Map<String, Object> visitLiteral(Expression.Literal expr) {
            var map = start(expr);
            map.put("value", expr.value());
            return map;
        }

        @Override
        public Map<String, Object> visitState(Expression.StateRef expr) {
            return named(expr, expr.name(), expr.path());
        }

        @Override
        public Map<String, Object> visitVar(Expression.VarRef expr) {
            return named(expr, expr.name(), expr.path());
        }

        @Override
        public Map<String, Object> visitBinary(Expression.Binary expr) {
            var map = start(expr);
            map.put("op", expr.op());
            map.put("left", expression(expr.left()));
            map.put("right", expression(expr.right()));
            return map;
        }

        @Override
        public Map<String, Object> visitNot(Expression.Not expr) {
            var map = start(expr);
            map.put("operand", expression(expr.operand()));
            return map;
        }

        @Override
        public Map<String, Object> visitConditional(Expression.Conditional expr) {
            var map = start(expr);
            map.put("if", expression(expr.condition()));
            map.put("then", expression(expr.then()));
            map.put("else", expression(expr.otherwise()));
            return map;
        }

        @Override
        public Map<String, Object> visitGet(Expression.PropertyGet expr) {
            var map = start(expr);
            map.put("base", expression(expr.base()));
            map.put("path", expr.path());
            return map;
        }

        @Override
        public Map<String, Object> visitRoute(Expression.RouteRef expr) {
            var map = start(expr);
            map.put("name", expr.name());
            map.put("source", expr.source().wireName());
            return map;
        }

        @Override
        public Map<String, Object> visitImport(Expression.ImportRef expr) {
            return named(expr, expr.name(), expr.path());
        }

        @Override
        public Map<String, Object> visitData(Expression.DataRef expr) {
            return named(expr, expr.name(), expr.path());
        }

        @Override
        public Map<String, Object> visitRef(Expression.DomRef expr) {
            return named(expr, expr.name(), null);
        }

        @Override
        public Map<String, Object> visitIndex(Expression.IndexGet expr) {
            var map = start(expr);
            map.put("base", expression(expr.base()));
            map.put("key", expression(expr.key()));
            return map;
        }

        @Override
        public Map<String, Object> visitParam(Expression.ParamRef expr) {
            return named(expr, expr.name(), expr.path());
        }

        @Override
        public Map<String, Object> visitCall(Expression.Call expr) {
            var map = start(expr);
            map.put("target", expr.target() == null ? null : expression(expr.target()));
            map.put("method", expr.method());
            map.put("args", expressions(expr.args()));
            return map;
        }

        @Override
        public Map<String, Object> visitLambda(Expression.Lambda expr) {
            var map = start(expr);
            map.put("param", expr.param());
            putIfNotNull(map, "index", expr.index());
            map.put("body", expression(expr.body()));
            return map;
        }

        @Override
        public Map<String, Object> visitArray(Expression.ArrayLiteral expr) {
            var map = start(expr);
            map.put("elements", expressions(expr.elements()));
            return map;
        }

        @Override
        public Map<String, Object> visitConcat(Expression.Concat expr) {
            var map = start(expr);
            map.put("items", expressions(expr.items()));
            return map;
        }
    }

    private static final class StepWriter implements ActionStep.Visitor<Map<String, Object>> {
        private static Map<String, Object> start(ActionStep step) {
            return tagged("do", step.tag());
        }

        private static void callbacks(Map<String, Object> map, List<ActionStep> onSuccess, List<ActionStep> onError) {
            if (!onSuccess.isEmpty()) {
                map.put("onSuccess", steps(onSuccess));
            }
            if (!onError.isEmpty()) {
                map.put("onError", steps(onError));
            }
        }

        @Override
        public Map<String, Object> visitSet(ActionStep.Set step) {
            var map = start(step);
            map.put("target", step.target());
            map.put("value", expression(step.value()));
            return map;
        }

        @Override
        public Map<String, Object> visitUpdate(ActionStep.Update step) {
            var map = start(step);
            map.put("target", step.target());
            map.put("operation", step.operation());
            putExpression(map, "value", step.value());
            putExpression(map, "index", step.index());
            putExpression(map, "deleteCount", step.deleteCount());
            return map;
        }

        @Override
        public Map<String, Object> visitSetPath(ActionStep.SetPath step) {
            var map = start(step);
            map.put("target", step.target());
            map.put("path", expression(step.path()));
            map.put("value", expression(step.value()));
            return map;
        }

        @Override
        public Map<String, Object> visitFetch(ActionStep.Fetch step) {
            var map = start(step);
            map.put("url", expression(step.url()));
            putIfNotNull(map, "method", step.method());
            putExpression(map, "body", step.body());
            putIfNotNull(map, "result", step.result());
            callbacks(map, step.onSuccess(), step.onError());
            return map;
        }

        @Override
        public Map<String, Object> visitStorage(ActionStep.Storage step) {
            var map = start(step);
            map.put("operation", step.operation());
            map.put("key", expression(step.key()));
            putIfNotNull(map, "storage", step.storage());
            putExpression(map, "value", step.value());
            putIfNotNull(map, "result", step.result());
            callbacks(map, step.onSuccess(), step.onError());
            return map;
        }

        @Override
        public Map<String, Object> visitClipboard(ActionStep.Clipboard step) {
            var map = start(step);
            map.put("operation", step.operation());
            putExpression(map, "value", step.value());
            putIfNotNull(map, "result", step.result());
            callbacks(map, step.onSuccess(), step.onError());
            return map;
        }

        @Override
        public Map<String, Object> visitNavigate(ActionStep.Navigate step) {
            var map = start(step);
            map.put("url", expression(step.url()));
            putIfNotNull(map, "target", step.target());
            putIfNotNull(map, "replace", step.replace());
            return map;
        }

        @Override
        public Map<String, Object> visitImport(ActionStep.Import step) {
            var map = start(step);
            map.put("module", step.module());
            putIfNotNull(map, "result", step.result());
            callbacks(map, step.onSuccess(), step.onError());
            return map;
        }

        @Override
        public Map<String, Object> visitCall(ActionStep.Call step) {
            var map = start(step);
            map.put("target", expression(step.target()));
            map.put("args", expressions(step.args()));
            putIfNotNull(map, "result", step.result());
            callbacks(map, step.onSuccess(), step.onError());
            return map;
        }

        @Override
        public Map<String, Object> visitSubscribe(ActionStep.Subscribe step) {
            var map = start(step);
            map.put("target", expression(step.target()));
            map.put("event", step.event());
            map.put("action", step.action());
            return map;
        }

        @Override
        public Map<String, Object> visitDispose(ActionStep.Dispose step) {
            var map = start(step);
            map.put("target", expression(step.target()));
            return map;
        }

        @Override
        public Map<String, Object> visitDom(ActionStep.Dom step) {
            var map = start(step);
            map.put("operation", step.operation());
            map.put("selector", expression(step.selector()));
            putExpression(map, "value", step.value());
            putIfNotNull(map, "attribute", step.attribute());
            return map;
        }

        @Override
        public Map<String, Object> visitIf(ActionStep.If step) {
            var map = start(step);
            map.put("condition", expression(step.condition()));
            map.put("then", steps(step.then()));
            if (!step.otherwise().isEmpty()) {
                map.put("else", steps(step.otherwise()));
            }
            return map;
        }

        @Override
        public Map<String, Object> visitDelay(ActionStep.Delay step) {
            var map = start(step);
            map.put("ms", expression(step.ms()));
            map.put("then", steps(step.then()));
            putIfNotNull(map, "result", step.result());
            return map;
        }

        @Override
        public Map<String, Object> visitInterval(ActionStep.Interval step) {
            var map = start(step);
            map.put("ms", expression(step.ms()));
            map.put("action", step.action());
            putIfNotNull(map, "result", step.result());
            return map;
        }

        @Override
        public Map<String, Object> visitClearTimer(ActionStep.ClearTimer step) {
            var map = start(step);
            map.put("target", expression(step.target()));
            return map;
        }

        @Override
        public Map<String, Object> visitFocus(ActionStep.Focus step) {
            var map = start(step);
            map.put("target", expression(step.target()));
            map.put("operation", step.operation());
            callbacks(map, step.onSuccess(), step.onError());
            return map;
        }

        @Override
        public Map<String, Object> visitUnknown(ActionStep.Unknown step) {
            var map = new LinkedHashMap<String, Object>(step.raw());
            map.put("do", step.tag());
            return map;
        }

        @Override
        public Map<String, Object> visitNoOp(ActionStep.NoOp step) {
            return start(step);
        }
    }

    /** Source view nodes, written for the component table carried by compiled programs. */
    private static final class ViewWriter implements ViewNode.Visitor<Map<String, Object>> {
        private static Map<String, Object> start(ViewNode node) {
            return tagged("kind", node.kind());
        }

        private static List<Object> children(List<ViewNode> children) {
            var list = new ArrayList<Object>(children.size());
            for (var child : children) {
                list.add(view(child));
            }
            return list;
        }

        @Override
        public Map<String, Object> visitElement(ViewNode.Element node) {
            var map = start(node);
            map.put("tag", node.tag());
            putIfNotNull(map, "ref", node.ref());
            map.put("props", props(node.props()));
            map.put("children", children(node.children()));
            return map;
        }

        @Override
        public Map<String, Object> visitText(ViewNode.Text node) {
            var map = start(node);
            map.put("value", expression(node.value()));
            return map;
        }

        @Override
        public Map<String, Object> visitIf(ViewNode.If node) {
            var map = start(node);
            map.put("condition", expression(node.condition()));
            map.put("then", view(node.then()));
            if (node.otherwise() != null) {
                map.put("else", view(node.otherwise()));
            }
            return map;
        }

        @Override
        public Map<String, Object> visitEach(ViewNode.Each node) {
            var map = start(node);
            map.put("items", expression(node.items()));
            map.put("as", node.as());
            putIfNotNull(map, "index", node.index());
            putExpression(map, "key", node.key());
            map.put("body", view(node.body()));
            return map;
        }

        @Override
        public Map<String, Object> visitComponent(ViewNode.Component node) {
            var map = start(node);
            map.put("name", node.name());
            map.put("props", props(node.props()));
            map.put("children", children(node.children()));
            return map;
        }

        @Override
        public Map<String, Object> visitSlot(ViewNode.Slot node) {
            var map = start(node);
            putIfNotNull(map, "name", node.name());
            return map;
        }

        @Override
        public Map<String, Object> visitMarkdown(ViewNode.Markdown node) {
            var map = start(node);
            map.put("content", expression(node.content()));
            return map;
        }

        @Override
        public Map<String, Object> visitCode(ViewNode.Code node) {
            var map = start(node);
            map.put("language", expression(node.language()));
            map.put("content", expression(node.content()));
            return map;
        }

        @Override
        public Map<String, Object> visitPortal(ViewNode.Portal node) {
            var map = start(node);
            map.put("target", node.target());
            map.put("children", children(node.children()));
            return map;
        }

        @Override
        public Map<String, Object> visitIsland(ViewNode.Island node) {
            var map = start(node);
            map.put("id", node.id());
            map.put("strategy", node.strategy());
            if (!node.strategyOptions().isEmpty()) {
                map.put("strategyOptions", node.strategyOptions());
            }
            map.put("content", view(node.content()));
            map.put("state", state(node.state()));
            map.put("actions", actions(node.actions()));
            return map;
        }

        @Override
        public Map<String, Object> visitSuspense(ViewNode.Suspense node) {
            var map = start(node);
            map.put("id", node.id());
            map.put("fallback", view(node.fallback()));
            map.put("content", view(node.content()));
            return map;
        }

        @Override
        public Map<String, Object> visitErrorBoundary(ViewNode.ErrorBoundary node) {
            var map = start(node);
            map.put("fallback", view(node.fallback()));
            map.put("content", view(node.content()));
            return map;
        }
    }

    private static final class CompiledWriter implements CompiledNode.Visitor<Map<String, Object>> {
        private static Map<String, Object> start(CompiledNode node) {
            return tagged("kind", node.kind());
        }

        private static List<Object> children(List<CompiledNode> children) {
            var list = new ArrayList<Object>(children.size());
            for (var child : children) {
                list.add(node(child));
            }
            return list;
        }

        @Override
        public Map<String, Object> visitElement(CompiledNode.Element node) {
            var map = start(node);
            map.put("tag", node.tag());
            putIfNotNull(map, "ref", node.ref());
            map.put("props", props(node.props()));
            map.put("children", children(node.children()));
            return map;
        }

        @Override
        public Map<String, Object> visitText(CompiledNode.Text node) {
            var map = start(node);
            map.put("value", expression(node.value()));
            return map;
        }

        @Override
        public Map<String, Object> visitIf(CompiledNode.If node) {
            var map = start(node);
            map.put("condition", expression(node.condition()));
            map.put("then", node(node.then()));
            if (node.otherwise() != null) {
                map.put("else", node(node.otherwise()));
            }
            return map;
        }

        @Override
        public Map<String, Object> visitEach(CompiledNode.Each node) {
            var map = start(node);
            map.put("items", expression(node.items()));
            map.put("as", node.as());
            putIfNotNull(map, "index", node.index());
            putExpression(map, "key", node.key());
            map.put("body", node(node.body()));
            return map;
        }

        @Override
        public Map<String, Object> visitMarkdown(CompiledNode.Markdown node) {
            var map = start(node);
            map.put("content", expression(node.content()));
            return map;
        }

        @Override
        public Map<String, Object> visitCode(CompiledNode.Code node) {
            var map = start(node);
            map.put("language", expression(node.language()));
            map.put("content", expression(node.content()));
            return map;
        }

        @Override
        public Map<String, Object> visitSlot(CompiledNode.Slot node) {
            var map = start(node);
            putIfNotNull(map, "name", node.name());
            return map;
        }

        @Override
        public Map<String, Object> visitPortal(CompiledNode.Portal node) {
            var map = start(node);
            map.put("target", node.target());
            map.put("children", children(node.children()));
            return map;
        }

        @Override
        public Map<String, Object> visitLocalState(CompiledNode.LocalState node) {
            var map = start(node);
            map.put("state", state(node.state()));
            map.put("actions", actions(node.actions()));
            map.put("child", node(node.child()));
            return map;
        }

        @Override
        public Map<String, Object> visitIsland(CompiledNode.Island node) {
            var map = start(node);
            map.put("id", node.id());
            map.put("strategy", node.strategy());
            if (!node.strategyOptions().isEmpty()) {
                map.put("strategyOptions", node.strategyOptions());
            }
            map.put("content", node(node.content()));
            map.put("state", state(node.state()));
            map.put("actions", actions(node.actions()));
            return map;
        }

        @Override
        public Map<String, Object> visitSuspense(CompiledNode.Suspense node) {
            var map = start(node);
            map.put("id", node.id());
            map.put("fallback", node(node.fallback()));
            map.put("content", node(node.content()));
            return map;
        }

        @Override
        public Map<String, Object> visitErrorBoundary(CompiledNode.ErrorBoundary node) {
            var map = start(node);
            map.put("fallback", node(node.fallback()));
            map.put("content", node(node.content()));
            return map;
        }
    }
}
