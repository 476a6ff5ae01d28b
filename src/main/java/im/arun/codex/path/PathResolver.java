package im.arun.codex.path;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.io.CodexFormat;
import im.arun.codex.model.ContentNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * All filesystem path arithmetic for explode, implode and index resolution:
 * filename sanitizing, output pattern expansion, include target resolution and
 * include path generation.
 */
public class PathResolver {
    private static final Logger logger = LoggerFactory.getLogger(PathResolver.class);

    public static final String UNTITLED = "untitled";
    public static final int MAX_NAME_LENGTH = 100;

    private static final Pattern ILLEGAL_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f\\x7f]");
    private static final Pattern DOT_RUNS = Pattern.compile("\\.{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern YAML_EXTENSION = Pattern.compile("(?i)\\.ya?ml$");
    private static final Pattern JSON_EXTENSION = Pattern.compile("(?i)\\.json$");

    private final boolean enforceContainment;

    public PathResolver() {
        this(true);
    }

    public PathResolver(CodexConfig config) {
        this(config.isEnforceContainment());
    }

    public PathResolver(boolean enforceContainment) {
        this.enforceContainment = enforceContainment;
    }

    /**
     * Values substituted into an output pattern.
     */
    @Data
    @AllArgsConstructor
    public static class PlaceholderContext {
        private String type;
        private String name;
        private String id;
        private int index;

        /**
         * Context for the {@code index}-th extracted child, with the same fallbacks
         * used when the standalone file is written.
         */
        public static PlaceholderContext of(ContentNode node, int index) {
            String type = node.getType() != null && !node.getType().isBlank() ? node.getType() : "node";
            String name = node.displayName("Untitled");
            String id = node.getId() != null && !node.getId().isBlank() ? node.getId() : "child_" + index;
            return new PlaceholderContext(type, name, id, index);
        }
    }

    /**
     * Turns an arbitrary display name into a safe single path segment.
     * The result never contains a path separator, never starts with a dot, never
     * contains {@code ..} and is never empty.
     */
    public static String sanitizeName(String name) {
        if (name == null || name.equals(".") || name.equals("..")) {
            return UNTITLED;
        }

        String safeName = ILLEGAL_CHARS.matcher(name).replaceAll("");
        safeName = DOT_RUNS.matcher(safeName).replaceAll(".");
        safeName = WHITESPACE.matcher(safeName).replaceAll(" ").trim().replace(' ', '-');

        // No hidden files
        while (safeName.startsWith(".")) {
            safeName = safeName.substring(1);
        }

        if (safeName.length() > MAX_NAME_LENGTH) {
            safeName = safeName.substring(0, MAX_NAME_LENGTH);
        }

        return safeName.isEmpty() ? UNTITLED : safeName;
    }

    /**
     * Expands {@code {type}}, {@code {name}}, {@code {id}} and {@code {index}} in the
     * pattern, forces the extension to match {@code format} and resolves relative
     * results against {@code parentDir}.
     */
    public Path resolveOutputPath(String pattern, PlaceholderContext context, Path parentDir, CodexFormat format) {
        String output = pattern
            .replace("{type}", sanitizeName(context.getType()))
            .replace("{name}", sanitizeName(context.getName()))
            .replace("{id}", sanitizeName(context.getId()))
            .replace("{index}", String.valueOf(context.getIndex()));

        output = forceExtension(output, format);

        Path outputPath = Paths.get(output);
        if (!outputPath.isAbsolute()) {
            outputPath = parentDir.resolve(outputPath);
        }
        return outputPath.toAbsolutePath().normalize();
    }

    static String forceExtension(String path, CodexFormat format) {
        if (format == CodexFormat.JSON) {
            if (JSON_EXTENSION.matcher(path).find()) {
                return path;
            }
            String stem = YAML_EXTENSION.matcher(path).replaceFirst("");
            return stem.toLowerCase(Locale.ROOT).endsWith(".codex") ? stem + ".json" : stem + ".codex.json";
        }

        if (YAML_EXTENSION.matcher(path).find()) {
            return path;
        }
        String stem = JSON_EXTENSION.matcher(path).replaceFirst("");
        return stem.toLowerCase(Locale.ROOT).endsWith(".codex") ? stem + ".yaml" : stem + ".codex.yaml";
    }

    /**
     * Resolves an include directive. A leading {@code /} means relative to the owning
     * document's directory; anything else is relative to {@code baseDir} as well.
     * No containment check is applied here.
     */
    public Path resolveIncludePath(String include, Path baseDir) {
        if (include == null || include.isBlank()) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE, "Empty include path");
        }

        String normalized = include.replace('\\', '/');
        try {
            Path target;
            if (normalized.startsWith("/")) {
                String relative = normalized.replaceFirst("^/+", "");
                target = relative.isEmpty() ? baseDir : baseDir.resolve(relative);
            } else {
                Path candidate = Paths.get(normalized);
                target = candidate.isAbsolute() ? candidate : baseDir.resolve(candidate);
            }
            return target.toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE,
                "Invalid include path '" + include + "': " + e.getReason(), e);
        }
    }

    /**
     * Like {@link #resolveIncludePath(String, Path)} but rejects targets that
     * normalize outside {@code root} when containment is enforced.
     */
    public Path resolveIncludePath(String include, Path baseDir, Path root) {
        Path target = resolveIncludePath(include, baseDir);
        if (enforceContainment && root != null && !isContained(target, root)) {
            logger.warn("Include '{}' escapes project root {}", include, root);
            throw new CodexException(CodexErrorKind.PATH_ESCAPE,
                "Include '" + include + "' resolves outside the project root: " + target);
        }
        return target;
    }

    public static boolean isContained(Path target, Path root) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        return target.toAbsolutePath().normalize().startsWith(normalizedRoot);
    }

    /**
     * Include directive text for a file written under {@code parentDir}: a POSIX path
     * with a leading {@code /}, relative to {@code parentDir}. Falls back to the
     * absolute path when no relative path exists (different roots).
     */
    public static String generateIncludePath(Path outputPath, Path parentDir) {
        Path absoluteOutput = outputPath.toAbsolutePath().normalize();
        try {
            Path relative = parentDir.toAbsolutePath().normalize().relativize(absoluteOutput);
            return "/" + toPosix(relative);
        } catch (IllegalArgumentException e) {
            logger.debug("No relative path from {} to {}: {}", parentDir, outputPath, e.getMessage());
            return toPosix(absoluteOutput);
        }
    }

    /**
     * {@code target} relative to {@code root} with forward slashes; empty for the root itself.
     */
    public static String relativePosix(Path root, Path target) {
        try {
            return toPosix(root.toAbsolutePath().normalize().relativize(target.toAbsolutePath().normalize()));
        } catch (IllegalArgumentException e) {
            return toPosix(target.toAbsolutePath().normalize());
        }
    }

    public static String toPosix(Path path) {
        return path.toString().replace('\\', '/');
    }
}
