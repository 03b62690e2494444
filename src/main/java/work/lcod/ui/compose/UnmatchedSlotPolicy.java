package work.lcod.ui.compose;

import java.util.Locale;

/**
 * What composition does with a named slot that receives no content.
 */
public enum UnmatchedSlotPolicy {
    /** Replace it with an empty text node. */
    EMPTY,
    /** Leave the slot node in the composed view. */
    KEEP;

    public static UnmatchedSlotPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return EMPTY;
        }
        try {
            return UnmatchedSlotPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported unmatched slot policy: " + value);
        }
    }
}
