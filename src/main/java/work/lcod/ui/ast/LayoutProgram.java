package work.lcod.ui.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A layout: a program tagged {@code "type": "layout"} whose view holds slot insertion points.
 * Layouts never carry a route or lifecycle hooks.
 */
public record LayoutProgram(
    String version,
    Map<String, StateField> state,
    List<ActionDefinition> actions,
    ViewNode view,
    Map<String, ComponentDef> components,
    Map<String, Object> importData
) {
    public LayoutProgram {
        version = version == null ? Program.DEFAULT_VERSION : version;
        Objects.requireNonNull(view, "view");
        state = JsonValues.orderedCopy(state);
        actions = JsonValues.listCopy(actions);
        components = JsonValues.orderedCopy(components);
        importData = JsonValues.immutableObject(importData);
    }

    public static LayoutProgram of(ViewNode view) {
        return new LayoutProgram(Program.DEFAULT_VERSION, Map.of(), List.of(), view, Map.of(), Map.of());
    }
}
