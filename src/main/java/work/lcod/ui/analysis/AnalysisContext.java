package work.lcod.ui.analysis;

import java.util.Set;

/**
 * Names declared by an analyzed program, built fresh per analysis call.
 */
public record AnalysisContext(
    Set<String> stateNames,
    Set<String> actionNames,
    Set<String> componentNames,
    Set<String> routeParams,
    Set<String> importNames
) {
    public AnalysisContext {
        stateNames = Set.copyOf(stateNames);
        actionNames = Set.copyOf(actionNames);
        componentNames = Set.copyOf(componentNames);
        routeParams = Set.copyOf(routeParams);
        importNames = Set.copyOf(importNames);
    }
}
