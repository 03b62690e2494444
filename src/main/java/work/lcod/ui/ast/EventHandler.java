package work.lcod.ui.ast;

import java.util.Map;
import java.util.Objects;

/**
 * Binds a DOM event to a named action.
 *
 * <p>The payload is either a single expression ({@link #payload()}) or an object of named expressions
 * ({@link #payloadFields()}); at most one of the two is set.</p>
 */
public record EventHandler(
    String event,
    String action,
    Expression payload,
    Map<String, Expression> payloadFields,
    Integer debounce,
    Integer throttle,
    Map<String, Object> options
) implements PropValue {
    public EventHandler {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(action, "action");
        payloadFields = JsonValues.orderedCopy(payloadFields);
        options = JsonValues.immutableObject(options);
    }

    public static EventHandler of(String event, String action) {
        return new EventHandler(event, action, null, Map.of(), null, null, Map.of());
    }

    public EventHandler withPayload(Expression newPayload, Map<String, Expression> newFields) {
        return new EventHandler(event, action, newPayload, newFields, debounce, throttle, options);
    }
}
