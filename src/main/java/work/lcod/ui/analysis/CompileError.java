package work.lcod.ui.analysis;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One diagnostic: code, human-readable message and the pointer of the offending value.
 */
public record CompileError(ErrorCode code, String message, String path) {
    public CompileError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(path, "path");
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code.name());
        map.put("message", message);
        map.put("path", path);
        return map;
    }

    @Override
    public String toString() {
        return code + " at " + path + ": " + message;
    }
}
