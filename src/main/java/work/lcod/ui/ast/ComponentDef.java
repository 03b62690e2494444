package work.lcod.ui.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reusable view fragment expanded at every call site.
 */
public record ComponentDef(
    Map<String, ParamDef> params,
    Map<String, StateField> localState,
    List<ActionDefinition> localActions,
    ViewNode view
) {
    public ComponentDef {
        Objects.requireNonNull(view, "view");
        params = JsonValues.orderedCopy(params);
        localState = JsonValues.orderedCopy(localState);
        localActions = JsonValues.listCopy(localActions);
    }

    public static ComponentDef of(ViewNode view) {
        return new ComponentDef(Map.of(), Map.of(), List.of(), view);
    }

    public boolean hasLocalState() {
        return !localState.isEmpty();
    }
}
