package work.lcod.ui.ast;

import java.util.List;
import java.util.Objects;

/**
 * Named, ordered list of steps. Used unchanged by compiled programs.
 */
public record ActionDefinition(String name, List<ActionStep> steps) {
    public ActionDefinition {
        Objects.requireNonNull(name, "name");
        steps = JsonValues.listCopy(steps);
    }

    public ActionDefinition withName(String newName) {
        return new ActionDefinition(newName, steps);
    }
}
