package work.lcod.ui.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import work.lcod.ui.analysis.CompileError;

/**
 * Outcome of a {@link UiCompiler} call: the output on success, otherwise every diagnostic found.
 */
public record CompileResult<T>(Status status, T output, List<CompileError> errors) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public CompileResult {
        errors = List.copyOf(errors);
    }

    public static <T> CompileResult<T> success(T output) {
        return new CompileResult<>(Status.SUCCESS, output, List.of());
    }

    public static <T> CompileResult<T> failure(List<CompileError> errors) {
        return new CompileResult<>(Status.FAILURE, null, errors);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<T> outputIfPresent() {
        return Optional.ofNullable(output);
    }

    /** Status and diagnostics; the output is serialized separately by the caller. */
    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        var serializedErrors = new ArrayList<Map<String, Object>>(errors.size());
        for (var error : errors) {
            serializedErrors.add(error.toSerializableMap());
        }
        serializable.put("errors", serializedErrors);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
