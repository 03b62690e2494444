package work.lcod.ui.ast;

import java.util.Objects;

/**
 * Declared state slot. {@code initial} is a plain JSON value, or an {@link Expression} for component-local
 * fields derived from params.
 */
public record StateField(String type, Object initial) {
    public StateField {
        Objects.requireNonNull(type, "type");
        if (!(initial instanceof Expression)) {
            initial = JsonValues.immutableCopy(initial);
        }
    }
}
