package work.lcod.ui.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A page program as read from its source file.
 *
 * @param route      optional, null when the page declares none
 * @param lifecycle  optional
 * @param importData resolved import values, opaque to the compiler
 */
public record Program(
    String version,
    Map<String, StateField> state,
    List<ActionDefinition> actions,
    ViewNode view,
    RouteDefinition route,
    LifecycleHooks lifecycle,
    Map<String, ComponentDef> components,
    Map<String, Object> importData
) {
    public static final String DEFAULT_VERSION = "1.0";

    public Program {
        version = version == null ? DEFAULT_VERSION : version;
        Objects.requireNonNull(view, "view");
        state = JsonValues.orderedCopy(state);
        actions = JsonValues.listCopy(actions);
        components = JsonValues.orderedCopy(components);
        importData = JsonValues.immutableObject(importData);
    }

    public static Program of(ViewNode view) {
        return new Program(DEFAULT_VERSION, Map.of(), List.of(), view, null, null, Map.of(), Map.of());
    }
}
