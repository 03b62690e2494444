package work.lcod.ui.io;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.EventHandler;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.LayoutProgram;
import work.lcod.ui.ast.LifecycleHooks;
import work.lcod.ui.ast.ParamDef;
import work.lcod.ui.ast.Program;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.RouteDefinition;
import work.lcod.ui.ast.RouteSource;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;

/**
 * Maps a plain JSON tree (maps, lists, scalars) onto the AST.
 *
 * <p>Only shapes are mapped; names are not resolved here. Any value that cannot be mapped raises a
 * {@link ProgramFormatException} carrying its pointer.</p>
 */
public final class AstMapper {
    private AstMapper() {}

    public static boolean isLayout(Map<?, ?> root) {
        return "layout".equals(root.get("type"));
    }

    public static Program program(Map<?, ?> root) {
        return new Program(
            version(root),
            stateMap(root.get("state"), "/state"),
            actions(root.get("actions"), "/actions"),
            view(required(root, "view", ""), "/view"),
            route(root.get("route"), "/route"),
            lifecycle(root.get("lifecycle"), "/lifecycle"),
            components(root.get("components"), "/components"),
            jsonObject(root.get("importData"), "/importData")
        );
    }

    public static LayoutProgram layout(Map<?, ?> root) {
        return new LayoutProgram(
            version(root),
            stateMap(root.get("state"), "/state"),
            actions(root.get("actions"), "/actions"),
            view(required(root, "view", ""), "/view"),
            components(root.get("components"), "/components"),
            jsonObject(root.get("importData"), "/importData")
        );
    }

    // ---------------------------------------------------------------- program parts

    private static String version(Map<?, ?> root) {
        Object value = root.get("version");
        return value == null ? null : String.valueOf(value);
    }

    private static RouteDefinition route(Object value, String pointer) {
        if (value == null) {
            return null;
        }
        var map = object(value, pointer);
        return new RouteDefinition(
            string(map, "path", pointer),
            optExpression(map.get("title"), pointer + "/title"),
            optString(map, "layout", pointer),
            expressionMap(map.get("layoutParams"), pointer + "/layoutParams"),
            expressionMap(map.get("meta"), pointer + "/meta"),
            optExpression(map.get("canonical"), pointer + "/canonical")
        );
    }

    private static LifecycleHooks lifecycle(Object value, String pointer) {
        if (value == null) {
            return null;
        }
        var map = object(value, pointer);
        return new LifecycleHooks(
            optString(map, "onMount", pointer),
            optString(map, "onUnmount", pointer),
            optString(map, "onRouteEnter", pointer),
            optString(map, "onRouteLeave", pointer)
        );
    }

    private static Map<String, ComponentDef> components(Object value, String pointer) {
        var result = new LinkedHashMap<String, ComponentDef>();
        if (value == null) {
            return result;
        }
        for (var entry : object(value, pointer).entrySet()) {
            String name = String.valueOf(entry.getKey());
            result.put(name, component(entry.getValue(), pointer + "/" + name));
        }
        return result;
    }

    public static ComponentDef component(Object value, String pointer) {
        var map = object(value, pointer);
        var params = new LinkedHashMap<String, ParamDef>();
        if (map.get("params") != null) {
            for (var entry : object(map.get("params"), pointer + "/params").entrySet()) {
                String name = String.valueOf(entry.getKey());
                String paramPointer = pointer + "/params/" + name;
                var param = object(entry.getValue(), paramPointer);
                boolean isRequired = !(param.get("required") instanceof Boolean flag) || flag;
                params.put(name, new ParamDef(optString(param, "type", paramPointer, "any"), isRequired));
            }
        }
        return new ComponentDef(
            params,
            stateMap(map.get("localState"), pointer + "/localState"),
            actions(map.get("localActions"), pointer + "/localActions"),
            view(required(map, "view", pointer), pointer + "/view")
        );
    }

    private static Map<String, StateField> stateMap(Object value, String pointer) {
        var result = new LinkedHashMap<String, StateField>();
        if (value == null) {
            return result;
        }
        for (var entry : object(value, pointer).entrySet()) {
            String name = String.valueOf(entry.getKey());
            String fieldPointer = pointer + "/" + name;
            var field = object(entry.getValue(), fieldPointer);
            Object initial = field.get("initial");
            if (isExpression(initial)) {
                initial = expression(initial, fieldPointer + "/initial");
            }
            result.put(name, new StateField(string(field, "type", fieldPointer), initial));
        }
        return result;
    }

    private static List<ActionDefinition> actions(Object value, String pointer) {
        var result = new ArrayList<ActionDefinition>();
        if (value == null) {
            return result;
        }
        var items = list(value, pointer);
        for (int i = 0; i < items.size(); i++) {
            String itemPointer = pointer + "/" + i;
            var action = object(items.get(i), itemPointer);
            result.add(new ActionDefinition(string(action, "name", itemPointer), steps(action.get("steps"), itemPointer + "/steps")));
        }
        return result;
    }

    // ---------------------------------------------------------------- view

    public static ViewNode view(Object value, String pointer) {
        var map = object(value, pointer);
        String kind = string(map, "kind", pointer);
        return switch (kind) {
            case "element" -> new ViewNode.Element(
                    string(map, "tag", pointer),
                    optString(map, "ref", pointer),
                    props(map.get("props"), pointer + "/props"),
                    views(map.get("children"), pointer + "/children")
                );
            case "text" -> new ViewNode.Text(expression(required(map, "value", pointer), pointer + "/value"));
            case "if" -> new ViewNode.If(
                    expression(required(map, "condition", pointer), pointer + "/condition"),
                    view(required(map, "then", pointer), pointer + "/then"),
                    map.get("else") == null ? null : view(map.get("else"), pointer + "/else")
                );
            case "each" -> new ViewNode.Each(
                    expression(required(map, "items", pointer), pointer + "/items"),
                    string(map, "as", pointer),
                    optString(map, "index", pointer),
                    optExpression(map.get("key"), pointer + "/key"),
                    view(required(map, "body", pointer), pointer + "/body")
                );
            case "component" -> new ViewNode.Component(
                    string(map, "name", pointer),
                    props(map.get("props"), pointer + "/props"),
                    views(map.get("children"), pointer + "/children")
                );
            case "slot" -> new ViewNode.Slot(optString(map, "name", pointer));
            case "markdown" -> new ViewNode.Markdown(expression(required(map, "content", pointer), pointer + "/content"));
            case "code" -> new ViewNode.Code(
                    expression(required(map, "language", pointer), pointer + "/language"),
                    expression(required(map, "content", pointer), pointer + "/content")
                );
            case "portal" -> new ViewNode.Portal(string(map, "target", pointer), views(map.get("children"), pointer + "/children"));
            case "island" -> new ViewNode.Island(
                    string(map, "id", pointer),
                    string(map, "strategy", pointer),
                    jsonObject(map.get("strategyOptions"), pointer + "/strategyOptions"),
                    view(required(map, "content", pointer), pointer + "/content"),
                    stateMap(map.get("state"), pointer + "/state"),
                    actions(map.get("actions"), pointer + "/actions")
                );
            case "suspense" -> new ViewNode.Suspense(
                    string(map, "id", pointer),
                    view(required(map, "fallback", pointer), pointer + "/fallback"),
                    view(required(map, "content", pointer), pointer + "/content")
                );
            case "errorBoundary" -> new ViewNode.ErrorBoundary(
                    view(required(map, "fallback", pointer), pointer + "/fallback"),
                    view(required(map, "content", pointer), pointer + "/content")
                );
            default -> throw new ProgramFormatException(pointer + "/kind", "Unknown view node kind '" + kind + "'");
        };
    }

    private static List<ViewNode> views(Object value, String pointer) {
        var result = new ArrayList<ViewNode>();
        if (value == null) {
            return result;
        }
        var items = list(value, pointer);
        for (int i = 0; i < items.size(); i++) {
            result.add(view(items.get(i), pointer + "/" + i));
        }
        return result;
    }

    private static Map<String, PropValue> props(Object value, String pointer) {
        var result = new LinkedHashMap<String, PropValue>();
        if (value == null) {
            return result;
        }
        for (var entry : object(value, pointer).entrySet()) {
            String name = String.valueOf(entry.getKey());
            String propPointer = pointer + "/" + name;
            var prop = object(entry.getValue(), propPointer);
            if (prop.containsKey("event")) {
                result.put(name, handler(prop, propPointer));
            } else {
                result.put(name, expression(prop, propPointer));
            }
        }
        return result;
    }

    private static EventHandler handler(Map<?, ?> map, String pointer) {
        Expression payload = null;
        Map<String, Expression> payloadFields = Map.of();
        Object rawPayload = map.get("payload");
        if (isExpression(rawPayload)) {
            payload = expression(rawPayload, pointer + "/payload");
        } else if (rawPayload != null) {
            payloadFields = expressionMap(rawPayload, pointer + "/payload");
        }
        return new EventHandler(
            string(map, "event", pointer),
            string(map, "action", pointer),
            payload,
            payloadFields,
            optInteger(map, "debounce", pointer),
            optInteger(map, "throttle", pointer),
            jsonObject(map.get("options"), pointer + "/options")
        );
    }

    // ---------------------------------------------------------------- expressions

    private static boolean isExpression(Object value) {
        return value instanceof Map<?, ?> map && map.get("expr") instanceof String;
    }

    public static Expression expression(Object value, String pointer) {
        var map = object(value, pointer);
        String tag = string(map, "expr", pointer);
        return switch (tag) {
            case "lit" -> new Expression.Literal(map.get("value"));
            case "state" -> new Expression.StateRef(string(map, "name", pointer), optString(map, "path", pointer));
            case "var" -> new Expression.VarRef(string(map, "name", pointer), optString(map, "path", pointer));
            case "bin" -> new Expression.Binary(
                    string(map, "op", pointer),
                    expression(required(map, "left", pointer), pointer + "/left"),
                    expression(required(map, "right", pointer), pointer + "/right")
                );
            case "not" -> new Expression.Not(expression(required(map, "operand", pointer), pointer + "/operand"));
            case "cond" -> new Expression.Conditional(
                    expression(required(map, "if", pointer), pointer + "/if"),
                    expression(required(map, "then", pointer), pointer + "/then"),
                    expression(required(map, "else", pointer), pointer + "/else")
                );
            case "get" -> new Expression.PropertyGet(
                    expression(required(map, "base", pointer), pointer + "/base"),
                    string(map, "path", pointer)
                );
            case "route" -> new Expression.RouteRef(string(map, "name", pointer), routeSource(map, pointer));
            case "import" -> new Expression.ImportRef(string(map, "name", pointer), optString(map, "path", pointer));
            case "data" -> new Expression.DataRef(string(map, "name", pointer), optString(map, "path", pointer));
            case "ref" -> new Expression.DomRef(string(map, "name", pointer));
            case "index" -> new Expression.IndexGet(
                    expression(required(map, "base", pointer), pointer + "/base"),
                    expression(required(map, "key", pointer), pointer + "/key")
                );
            case "param" -> new Expression.ParamRef(string(map, "name", pointer), optString(map, "path", pointer));
            case "call" -> new Expression.Call(
                    optExpression(map.get("target"), pointer + "/target"),
                    string(map, "method", pointer),
                    expressions(map.get("args"), pointer + "/args")
                );
            case "lambda" -> new Expression.Lambda(
                    string(map, "param", pointer),
                    optString(map, "index", pointer),
                    expression(required(map, "body", pointer), pointer + "/body")
                );
            case "array" -> new Expression.ArrayLiteral(expressions(map.get("elements"), pointer + "/elements"));
            case "concat" -> new Expression.Concat(expressions(map.get("items"), pointer + "/items"));
            default -> throw new ProgramFormatException(pointer + "/expr", "Unknown expression '" + tag + "'");
        };
    }

    private static RouteSource routeSource(Map<?, ?> map, String pointer) {
        try {
            return RouteSource.from(optString(map, "source", pointer));
        } catch (IllegalArgumentException ex) {
            throw new ProgramFormatException(pointer + "/source", ex.getMessage());
        }
    }

    private static Expression optExpression(Object value, String pointer) {
        return value == null ? null : expression(value, pointer);
    }

    private static List<Expression> expressions(Object value, String pointer) {
        var result = new ArrayList<Expression>();
        if (value == null) {
            return result;
        }
        var items = list(value, pointer);
        for (int i = 0; i < items.size(); i++) {
            result.add(expression(items.get(i), pointer + "/" + i));
        }
        return result;
    }

    private static Map<String, Expression> expressionMap(Object value, String pointer) {
        var result = new LinkedHashMap<String, Expression>();
        if (value == null) {
            return result;
        }
        for (var entry : object(value, pointer).entrySet()) {
            String name = String.valueOf(entry.getKey());
            result.put(name, expression(entry.getValue(), pointer + "/" + name));
        }
        return result;
    }

    // ---------------------------------------------------------------- steps

    private static List<ActionStep> steps(Object value, String pointer) {
        var result = new ArrayList<ActionStep>();
        if (value == null) {
            return result;
        }
        var items = list(value, pointer);
        for (int i = 0; i < items.size(); i++) {
            result.add(step(items.get(i), pointer + "/" + i));
        }
        return result;
    }

    public static ActionStep step(Object value, String pointer) {
        var map = object(value, pointer);
        String tag = string(map, "do", pointer);
        return switch (tag) {
            case "set" -> new ActionStep.Set(string(map, "target", pointer), expr(map, "value", pointer));
            case "update" -> new ActionStep.Update(
                    string(map, "target", pointer),
                    string(map, "operation", pointer),
                    optExpr(map, "value", pointer),
                    optExpr(map, "index", pointer),
                    optExpr(map, "deleteCount", pointer)
                );
            case "setPath" -> new ActionStep.SetPath(string(map, "target", pointer), expr(map, "path", pointer), expr(map, "value", pointer));
            case "fetch" -> new ActionStep.Fetch(
                    expr(map, "url", pointer),
                    optString(map, "method", pointer),
                    optExpr(map, "body", pointer),
                    optString(map, "result", pointer),
                    steps(map.get("onSuccess"), pointer + "/onSuccess"),
                    steps(map.get("onError"), pointer + "/onError")
                );
            case "storage" -> new ActionStep.Storage(
                    string(map, "operation", pointer),
                    expr(map, "key", pointer),
                    optString(map, "storage", pointer),
                    optExpr(map, "value", pointer),
                    optString(map, "result", pointer),
                    steps(map.get("onSuccess"), pointer + "/onSuccess"),
                    steps(map.get("onError"), pointer + "/onError")
                );
            case "clipboard" -> new ActionStep.Clipboard(
                    string(map, "operation", pointer),
                    optExpr(map, "value", pointer),
                    optString(map, "result", pointer),
                    steps(map.get("onSuccess"), pointer + "/onSuccess"),
                    steps(map.get("onError"), pointer + "/onError")
                );
            case "navigate" -> new ActionStep.Navigate(
                    expr(map, "url", pointer),
                    optString(map, "target", pointer),
                    map.get("replace") instanceof Boolean replace ? replace : null
                );
            case "import" -> new ActionStep.Import(
                    string(map, "module", pointer),
                    optString(map, "result", pointer),
                    steps(map.get("onSuccess"), pointer + "/onSuccess"),
                    steps(map.get("onError"), pointer + "/onError")
                );
            case "call" -> new ActionStep.Call(
                    expr(map, "target", pointer),
                    expressions(map.get("args"), pointer + "/args"),
                    optString(map, "result", pointer),
                    steps(map.get("onSuccess"), pointer + "/onSuccess"),
                    steps(map.get("onError"), pointer + "/onError")
                );
            case "subscribe" -> new ActionStep.Subscribe(expr(map, "target", pointer), string(map, "event", pointer), string(map, "action", pointer));
            case "dispose" -> new ActionStep.Dispose(expr(map, "target", pointer));
            case "dom" -> new ActionStep.Dom(
                    string(map, "operation", pointer),
                    expr(map, "selector", pointer),
                    optExpr(map, "value", pointer),
                    optString(map, "attribute", pointer)
                );
            case "if" -> new ActionStep.If(
                    expr(map, "condition", pointer),
                    steps(map.get("then"), pointer + "/then"),
                    steps(map.get("else"), pointer + "/else")
                );
            case "delay" -> new ActionStep.Delay(expr(map, "ms", pointer), steps(map.get("then"), pointer + "/then"), optString(map, "result", pointer));
            case "interval" -> new ActionStep.Interval(expr(map, "ms", pointer), string(map, "action", pointer), optString(map, "result", pointer));
            case "clearTimer" -> new ActionStep.ClearTimer(expr(map, "target", pointer));
            case "focus" -> new ActionStep.Focus(
                    expr(map, "target", pointer),
                    string(map, "operation", pointer),
                    steps(map.get("onSuccess"), pointer + "/onSuccess"),
                    steps(map.get("onError"), pointer + "/onError")
                );
            default -> new ActionStep.Unknown(tag, jsonObject(map, pointer));
        };
    }

    private static Expression expr(Map<?, ?> map, String key, String pointer) {
        return expression(required(map, key, pointer), pointer + "/" + key);
    }

    private static Expression optExpr(Map<?, ?> map, String key, String pointer) {
        return optExpression(map.get(key), pointer + "/" + key);
    }

    // ---------------------------------------------------------------- shapes

    private static Map<?, ?> object(Object value, String pointer) {
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new ProgramFormatException(pointer, "Expected an object");
    }

    private static List<?> list(Object value, String pointer) {
        if (value instanceof List<?> items) {
            return items;
        }
        throw new ProgramFormatException(pointer, "Expected an array");
    }

    private static Map<String, Object> jsonObject(Object value, String pointer) {
        var result = new LinkedHashMap<String, Object>();
        if (value == null) {
            return result;
        }
        for (var entry : object(value, pointer).entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    private static Object required(Map<?, ?> map, String key, String pointer) {
        Object value = map.get(key);
        if (value == null) {
            throw new ProgramFormatException(pointer + "/" + key, "Missing required member '" + key + "'");
        }
        return value;
    }

    private static String string(Map<?, ?> map, String key, String pointer) {
        Object value = required(map, key, pointer);
        if (value instanceof String text) {
            return text;
        }
        throw new ProgramFormatException(pointer + "/" + key, "Expected a string");
    }

    private static String optString(Map<?, ?> map, String key, String pointer) {
        return optString(map, key, pointer, null);
    }

    private static String optString(Map<?, ?> map, String key, String pointer, String fallback) {
        Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof String text) {
            return text;
        }
        throw new ProgramFormatException(pointer + "/" + key, "Expected a string");
    }

    private static Integer optInteger(Map<?, ?> map, String key, String pointer) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new ProgramFormatException(pointer + "/" + key, "Expected a number");
    }
}
