package work.lcod.ui.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.ui.ast.ActionDefinition;
import work.lcod.ui.ast.ActionStep;
import work.lcod.ui.ast.ComponentDef;
import work.lcod.ui.ast.Expression;
import work.lcod.ui.ast.ParamDef;
import work.lcod.ui.ast.PropValue;
import work.lcod.ui.ast.StateField;
import work.lcod.ui.ast.ViewNode;

/**
 * Small builders for AST values and access to the JSON fixtures under {@code src/test/resources/programs}.
 */
public final class AstFixtures {
    private AstFixtures() {}

    public static Path programPath(String name) {
        return Path.of("src", "test", "resources", "programs", name).toAbsolutePath();
    }

    public static String resource(String name) {
        try (InputStream in = AstFixtures.class.getResourceAsStream("/programs/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read fixture: " + name, ex);
        }
    }

    // ---------------------------------------------------------------- expressions

    public static Expression lit(Object value) {
        return Expression.literal(value);
    }

    public static Expression state(String name) {
        return new Expression.StateRef(name);
    }

    public static Expression variable(String name) {
        return new Expression.VarRef(name);
    }

    public static Expression param(String name) {
        return new Expression.ParamRef(name);
    }

    public static Expression param(String name, String path) {
        return new Expression.ParamRef(name, path);
    }

    // ---------------------------------------------------------------- view

    public static ViewNode text(String value) {
        return new ViewNode.Text(lit(value));
    }

    public static ViewNode text(Expression value) {
        return new ViewNode.Text(value);
    }

    public static ViewNode element(String tag, ViewNode... children) {
        return new ViewNode.Element(tag, null, Map.of(), List.of(children));
    }

    public static ViewNode element(String tag, Map<String, PropValue> props, ViewNode... children) {
        return new ViewNode.Element(tag, null, props, List.of(children));
    }

    public static ViewNode component(String name, Map<String, PropValue> props, ViewNode... children) {
        return new ViewNode.Component(name, props, List.of(children));
    }

    public static ViewNode slot() {
        return new ViewNode.Slot(null);
    }

    public static ViewNode slot(String name) {
        return new ViewNode.Slot(name);
    }

    public static ViewNode each(Expression items, String as, ViewNode body) {
        return new ViewNode.Each(items, as, null, null, body);
    }

    /** Alternating name/value pairs. */
    public static Map<String, PropValue> props(Object... pairs) {
        var props = new LinkedHashMap<String, PropValue>();
        for (int i = 0; i < pairs.length; i += 2) {
            props.put((String) pairs[i], (PropValue) pairs[i + 1]);
        }
        return props;
    }

    // ---------------------------------------------------------------- definitions

    public static ComponentDef componentDef(Map<String, ParamDef> params, ViewNode view) {
        return new ComponentDef(params, Map.of(), List.of(), view);
    }

    public static Map<String, ParamDef> requiredParams(String... names) {
        var params = new LinkedHashMap<String, ParamDef>();
        for (String name : names) {
            params.put(name, ParamDef.required("any"));
        }
        return params;
    }

    public static Map<String, StateField> stateFields(String... names) {
        var fields = new LinkedHashMap<String, StateField>();
        for (String name : names) {
            fields.put(name, new StateField("number", 0));
        }
        return fields;
    }

    public static ActionDefinition action(String name, ActionStep... steps) {
        return new ActionDefinition(name, List.of(steps));
    }

    public static List<ActionDefinition> actions(String... names) {
        var actions = new ArrayList<ActionDefinition>();
        for (String name : names) {
            actions.add(action(name));
        }
        return actions;
    }
}
