package work.lcod.ui.ast;

import java.util.Objects;

/**
 * Component parameter descriptor. Params are required unless declared {@code required: false}.
 */
public record ParamDef(String type, boolean required) {
    public ParamDef {
        Objects.requireNonNull(type, "type");
    }

    public static ParamDef required(String type) {
        return new ParamDef(type, true);
    }

    public static ParamDef optional(String type) {
        return new ParamDef(type, false);
    }
}
