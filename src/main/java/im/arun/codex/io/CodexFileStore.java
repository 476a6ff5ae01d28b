package im.arun.codex.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.model.ContentNode;
import im.arun.codex.model.IndexDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and writes codex documents as YAML or JSON.
 * <p>
 * Read failures are reported as {@link CodexException} with a structural kind so
 * callers can decide whether the failure aborts the operation or a single item.
 */
public class CodexFileStore {
    private static final Logger logger = LoggerFactory.getLogger(CodexFileStore.class);

    public static final String BACKUP_SUFFIX = ".backup";

    public static final Set<String> INDEX_FILENAMES = Set.of(
        "index.codex.yaml",
        ".index.codex.yaml",
        "index.codex.json",
        ".index.codex.json"
    );

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public CodexFileStore() {
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);

        YAMLFactory yamlFactory = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
            .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
            .build();
        this.yamlMapper = new ObjectMapper(yamlFactory);
    }

    public ObjectMapper mapper(CodexFormat format) {
        return format == CodexFormat.JSON ? jsonMapper : yamlMapper;
    }

    /**
     * True for {@code .codex.yaml}, {@code .codex.yml}, {@code .codex.json} and {@code .codex}.
     */
    public static boolean isCodexFile(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return lower.endsWith(".codex.yaml")
            || lower.endsWith(".codex.yml")
            || lower.endsWith(".codex.json")
            || lower.endsWith(".codex");
    }

    public static boolean isIndexFile(String fileName) {
        if (fileName == null) {
            return false;
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        return INDEX_FILENAMES.contains(fileName.substring(slash + 1));
    }

    /**
     * Format of an existing file: from its extension, else sniffed from its content.
     */
    public CodexFormat formatOf(Path file) {
        CodexFormat byExtension = CodexFormat.fromPath(file);
        return byExtension != null ? byExtension : CodexFormat.detect(readText(file));
    }

    // ---- content documents ----

    public ContentNode readContent(Path file) {
        String text = readText(file);
        JsonNode tree = parseTree(text, CodexFormat.of(file, text), file.toString());
        return toContent(tree, file.toString());
    }

    public ContentNode parseContent(String text, CodexFormat format) {
        JsonNode tree = parseTree(text, format != null ? format : CodexFormat.detect(text), "<text>");
        return toContent(tree, "<text>");
    }

    private ContentNode toContent(JsonNode tree, String source) {
        if (tree == null || !tree.isObject()) {
            throw new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "Invalid codex file structure: " + source);
        }
        JsonNode children = tree.get("children");
        if (children != null && !children.isNull() && !children.isArray()) {
            throw new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "'children' must be an array in " + source);
        }
        try {
            return jsonMapper.treeToValue(tree, ContentNode.class);
        } catch (JsonProcessingException e) {
            throw new CodexException(CodexErrorKind.PARSE_ERROR,
                "Malformed codex document " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    // ---- index documents ----

    public IndexDocument readIndex(Path file) {
        String text = readText(file);
        JsonNode tree = parseTree(text, CodexFormat.of(file, text), file.toString());
        return toIndex(tree, file.toString());
    }

    public IndexDocument parseIndex(String text) {
        JsonNode tree = parseTree(text, CodexFormat.detect(text), "<text>");
        return toIndex(tree, "<text>");
    }

    private IndexDocument toIndex(JsonNode tree, String source) {
        if (tree == null || !tree.isObject()) {
            throw new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "Invalid index file structure: " + source);
        }
        JsonNode children = tree.get("children");
        if (children != null && !children.isNull() && !children.isArray()) {
            throw new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "'children' must be an array in " + source);
        }
        try {
            return jsonMapper.treeToValue(tree, IndexDocument.class);
        } catch (JsonProcessingException e) {
            throw new CodexException(CodexErrorKind.PARSE_ERROR,
                "Malformed index document " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    // ---- shared ----

    public String readText(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new CodexException(CodexErrorKind.FILE_NOT_FOUND, "File not found: " + file);
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CodexException(CodexErrorKind.FILE_NOT_FOUND,
                "Unable to read " + file + ": " + e.getMessage(), e);
        }
    }

    private JsonNode parseTree(String text, CodexFormat format, String source) {
        try {
            return mapper(format).readTree(text);
        } catch (JsonProcessingException e) {
            throw new CodexException(CodexErrorKind.PARSE_ERROR,
                "Failed to parse " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializes {@code document} to {@code file}, creating parent directories.
     */
    public void write(Path file, Object document, CodexFormat format) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String text = mapper(format).writeValueAsString(document);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        logger.debug("Wrote {} ({})", file, format);
    }

    /**
     * Byte-for-byte copy to {@code <file>.backup}.
     */
    public Path backup(Path file) throws IOException {
        Path backupPath = file.resolveSibling(file.getFileName().toString() + BACKUP_SUFFIX);
        Files.copy(file, backupPath, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Backup written to {}", backupPath);
        return backupPath;
    }

    public JsonNode toTree(Object value) {
        return jsonMapper.valueToTree(value);
    }
}
