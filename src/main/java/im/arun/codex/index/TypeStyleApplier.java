package im.arun.codex.index;

import im.arun.codex.model.IndexEntry;
import im.arun.codex.model.IndexNode;
import im.arun.codex.model.TypeStyle;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Additive style and status passes over an index tree. Both walk pre-order and only
 * fill computed fields that are still empty, so running them again changes nothing.
 */
public final class TypeStyleApplier {

    private TypeStyleApplier() {}

    public static Map<String, TypeStyle> styleMap(List<TypeStyle> typeStyles) {
        Map<String, TypeStyle> styles = new HashMap<>();
        if (typeStyles != null) {
            for (TypeStyle style : typeStyles) {
                if (style != null && style.getType() != null) {
                    styles.put(style.getType(), style);
                }
            }
        }
        return styles;
    }

    /**
     * Sets {@code _type_emoji}/{@code _type_color} where the node has no explicit
     * emoji/color and no inherited value yet.
     */
    public static void applyTypeStyles(List<IndexEntry> entries, List<TypeStyle> typeStyles) {
        Map<String, TypeStyle> styles = styleMap(typeStyles);
        if (!styles.isEmpty()) {
            applyTypeStyles(entries, styles);
        }
    }

    private static void applyTypeStyles(List<IndexEntry> entries, Map<String, TypeStyle> styles) {
        if (entries == null) {
            return;
        }
        for (IndexEntry entry : entries) {
            if (!(entry instanceof IndexNode)) {
                continue;
            }
            IndexNode node = (IndexNode) entry;
            TypeStyle style = node.getType() == null ? null : styles.get(node.getType());
            if (style != null) {
                if (isBlank(node.getEmoji()) && node.getTypeEmoji() == null && style.getEmoji() != null) {
                    node.setTypeEmoji(style.getEmoji());
                }
                if (isBlank(node.getColor()) && node.getTypeColor() == null && style.getColor() != null) {
                    node.setTypeColor(style.getColor());
                }
            }
            applyTypeStyles(node.getChildren(), styles);
        }
    }

    public static void applyDefaultStatus(List<IndexEntry> entries, String defaultStatus) {
        if (entries == null) {
            return;
        }
        for (IndexEntry entry : entries) {
            if (entry instanceof IndexNode) {
                IndexNode node = (IndexNode) entry;
                if (isBlank(node.getDefaultStatus())) {
                    node.setDefaultStatus(defaultStatus);
                }
                applyDefaultStatus(node.getChildren(), defaultStatus);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
