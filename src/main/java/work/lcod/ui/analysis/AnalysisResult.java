package work.lcod.ui.analysis;

import java.util.List;

/**
 * Either a context (success) or the ordered list of every error found.
 */
public record AnalysisResult<C>(C context, List<CompileError> errors) {
    public AnalysisResult {
        errors = List.copyOf(errors);
        if (context == null && errors.isEmpty()) {
            throw new IllegalArgumentException("A failed analysis must carry at least one error");
        }
    }

    public static <C> AnalysisResult<C> success(C context) {
        return new AnalysisResult<>(context, List.of());
    }

    public static <C> AnalysisResult<C> failure(List<CompileError> errors) {
        return new AnalysisResult<>(null, errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }
}
