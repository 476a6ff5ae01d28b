package im.arun.codex.model;

import java.util.Locale;

/**
 * Where a dragged item lands relative to the drop target.
 */
public enum DropPosition {
    BEFORE,
    AFTER,
    INSIDE;

    public static DropPosition parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Drop position is required");
        }
        return DropPosition.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
