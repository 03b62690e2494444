package work.lcod.ui.analysis;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.ui.ast.Program;

/**
 * Validates name resolution across a page program.
 *
 * <p>Every error is collected; the result either carries an {@link AnalysisContext} or the full ordered list.</p>
 */
public final class SemanticAnalyzer {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final int maxDepth;

    public SemanticAnalyzer() {
        this(DEFAULT_MAX_DEPTH);
    }

    public SemanticAnalyzer(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public AnalysisResult<AnalysisContext> analyze(Program program) {
        var routeParams = program.route() == null
            ? null
            : new LinkedHashSet<>(program.route().pathParams());
        var declarations = new ReferenceValidator.Declarations(
            ReferenceValidator.stateNames(program.state()),
            ReferenceValidator.actionNames(program.actions()),
            program.components(),
            routeParams,
            new HashSet<>(program.importData().keySet())
        );
        var validator = new ReferenceValidator(declarations, false, maxDepth);
        if (program.lifecycle() != null) {
            for (var hook : program.lifecycle().declared().entrySet()) {
                if (!declarations.actions().contains(hook.getValue())) {
                    validator.report(CompileErrors.undefinedAction(
                        hook.getValue(),
                        ErrorPath.root().child("lifecycle").child(hook.getKey())
                    ));
                }
            }
        }
        validator.validate(program.actions(), program.view());

        if (!validator.errors().isEmpty()) {
            LOG.debug("Program analysis found {} error(s)", validator.errors().size());
            return AnalysisResult.failure(validator.errors());
        }
        return AnalysisResult.success(new AnalysisContext(
            declarations.state(),
            declarations.actions(),
            program.components().keySet(),
            routeParams == null ? Set.of() : routeParams,
            declarations.imports()
        ));
    }
}
