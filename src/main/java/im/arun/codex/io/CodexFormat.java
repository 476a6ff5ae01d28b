package im.arun.codex.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Serialization format of a codex file.
 */
public enum CodexFormat {
    YAML("yaml"),
    JSON("json");

    private final String extension;

    CodexFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static CodexFormat parse(String value) {
        if (value == null) {
            return YAML;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "json":
                return JSON;
            case "yaml":
            case "yml":
                return YAML;
            default:
                throw new IllegalArgumentException("Unknown codex format: " + value);
        }
    }

    /**
     * Format from the file extension; {@code null} when the extension does not say
     * (for example the bare {@code .codex} extension).
     */
    public static CodexFormat fromPath(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return JSON;
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        return null;
    }

    /**
     * Format sniffed from file content.
     */
    public static CodexFormat detect(String content) {
        String trimmed = content == null ? "" : content.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[") ? JSON : YAML;
    }

    public static CodexFormat of(Path path, String content) {
        CodexFormat byExtension = fromPath(path);
        return byExtension != null ? byExtension : detect(content);
    }
}
