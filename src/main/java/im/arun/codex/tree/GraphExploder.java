package im.arun.codex.tree;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.codex.config.CodexConfig;
import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.error.ItemFailure;
import im.arun.codex.io.CodexFileStore;
import im.arun.codex.io.CodexFormat;
import im.arun.codex.model.CodexEntry;
import im.arun.codex.model.ContentNode;
import im.arun.codex.model.IncludeStub;
import im.arun.codex.path.PathResolver;
import im.arun.codex.path.PathResolver.PlaceholderContext;
import im.arun.codex.util.BatchOutcome;
import im.arun.codex.util.BatchProcessor;
import im.arun.codex.util.CancellationToken;
import im.arun.codex.util.OperationJournal;
import im.arun.codex.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Splits the direct children of a content document into standalone codex files and
 * replaces them with include stubs.
 * <p>
 * Children are processed one at a time; a child that cannot be extracted is reported
 * and stays inline, the rest of the batch carries on.
 */
public class GraphExploder {
    private static final Logger logger = LoggerFactory.getLogger(GraphExploder.class);

    static final String FORMAT_VERSION = "1.1";
    static final String DOCUMENT_VERSION = "1.0.0";

    private final CodexConfig config;
    private final PathResolver pathResolver;
    private final CodexFileStore fileStore;

    public GraphExploder(CodexConfig config) {
        this(config, new PathResolver(config), new CodexFileStore());
    }

    public GraphExploder(CodexConfig config, PathResolver pathResolver, CodexFileStore fileStore) {
        this.config = config;
        this.pathResolver = pathResolver;
        this.fileStore = fileStore;
    }

    /**
     * Split of the direct children into the ones to extract and the ones to keep.
     */
    static class Partition {
        final List<ContentNode> extracted = new ArrayList<>();
        final List<CodexEntry> remaining = new ArrayList<>();
    }

    public ExplodeResult explode(Path documentPath, ExplodeOptions options) {
        return explode(documentPath, options, ProgressListener.NONE, CancellationToken.none());
    }

    public ExplodeResult explode(
            Path documentPath,
            ExplodeOptions options,
            ProgressListener progress,
            CancellationToken cancellation) {

        Path inputPath = documentPath.toAbsolutePath().normalize();
        OperationJournal journal = openJournal(inputPath);
        journal.info("Starting explode", Map.of(
            "document", inputPath.toString(),
            "types", options.extractsAll() ? "all" : String.join(",", options.getTypes()),
            "dryRun", options.isDryRun()
        ));

        ContentNode document;
        CodexFormat parentFormat;
        try {
            document = fileStore.readContent(inputPath);
            parentFormat = fileStore.formatOf(inputPath);
        } catch (CodexException e) {
            logger.error("Cannot explode {}: {}", inputPath, e.getMessage());
            journal.error(e.getMessage());
            return ExplodeResult.failure(e);
        }

        if (!document.hasChildren()) {
            CodexException e = new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "No 'children' array found in codex file: " + inputPath);
            logger.error(e.getMessage());
            journal.error(e.getMessage());
            return ExplodeResult.failure(e);
        }

        List<CodexEntry> children = document.getChildren();
        logger.info("Exploding {}: {} children, types filter: {}", inputPath, children.size(),
            options.extractsAll() ? "all (no filter)" : options.getTypes());

        if (children.isEmpty()) {
            return ExplodeResult.nothingToDo("Children array is empty - nothing to extract", options.isDryRun());
        }

        Partition partition = partition(children, options.getTypes());
        logger.debug("After filtering: {} extracted, {} remaining",
            partition.extracted.size(), partition.remaining.size());

        if (partition.extracted.isEmpty()) {
            return ExplodeResult.nothingToDo("No children matched the specified types: "
                + (options.extractsAll() ? "all" : String.join(", ", options.getTypes())), options.isDryRun());
        }

        Path parentDir = inputPath.getParent();
        ObjectNode parentMetadata = document.getMetadata();
        Set<Path> claimed = new HashSet<>();

        BatchOutcome<ContentNode, Path> outcome = BatchProcessor.fold(
            partition.extracted,
            child -> child.displayName("Untitled"),
            (child, index) -> extractChild(child, index, options, inputPath, parentMetadata, claimed),
            progress,
            cancellation
        );

        ExplodeResult result = new ExplodeResult();
        result.setSuccess(true);
        result.setDryRun(options.isDryRun());
        result.getFailures().addAll(outcome.itemFailures());
        result.getErrors().addAll(outcome.failureMessages());

        Map<Integer, Path> extractedByPosition = new HashMap<>();
        for (BatchOutcome.Success<ContentNode, Path> success : outcome.getSuccesses()) {
            extractedByPosition.put(success.position, success.value);
            result.getExtractedFiles().add(success.value.toString());

            String childId = PlaceholderContext.of(success.item, success.position).getId();
            String previous = result.getExtractionMap().put(childId, success.value.toString());
            if (previous != null) {
                result.getErrors().add(String.format(
                    "Duplicate child id '%s': extraction map keeps %s", childId, success.value));
            }
        }
        result.setExtractedCount(result.getExtractedFiles().size());

        if (outcome.isCancelled()) {
            result.getErrors().add("Explode cancelled: " + outcome.summary());
        } else if (outcome.hasFailures()) {
            journal.warn("Partial batch failure: " + outcome.summary());
        }

        if (!options.isDryRun() && !extractedByPosition.isEmpty()) {
            document.setChildren(replacementChildren(partition, extractedByPosition, parentDir));
            markExploded(document, options, result.getExtractedCount());

            try {
                if (options.isBackup()) {
                    result.setBackupFile(fileStore.backup(inputPath).toString());
                }
                fileStore.write(inputPath, document, parentFormat);
            } catch (IOException e) {
                CodexException failure = new CodexException(CodexErrorKind.IO_ERROR,
                    "Failed to update parent file " + inputPath + ": " + e.getMessage(), e);
                logger.error(failure.getMessage(), e);
                journal.error(failure.getMessage());
                result.setSuccess(false);
                result.getFailures().add(0, new ItemFailure(
                    "document", CodexErrorKind.IO_ERROR, failure.getMessage()));
                result.getErrors().add(0, failure.getMessage());
                return result;
            }
        }

        logger.info("{} {} of {} children from {}", options.isDryRun() ? "[DRY RUN] Would extract" : "Extracted",
            result.getExtractedCount(), partition.extracted.size(), inputPath);
        journal.info("Explode complete", Map.of(
            "extracted", result.getExtractedCount(),
            "failed", outcome.getFailures().size(),
            "files", result.getExtractedFiles()
        ));
        return result;
    }

    /**
     * Children whose type matches one of {@code types} (case-insensitive), or every
     * inline child when no types are given. Include stubs are never re-extracted.
     */
    static Partition partition(List<CodexEntry> children, List<String> types) {
        Partition partition = new Partition();
        Set<String> wanted = types == null ? Set.of() : types.stream()
            .map(type -> type.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

        for (CodexEntry child : children) {
            if (!(child instanceof ContentNode)) {
                partition.remaining.add(child);
                continue;
            }
            ContentNode node = (ContentNode) child;
            String childType = node.getType() == null ? "" : node.getType().toLowerCase(Locale.ROOT);
            if (wanted.isEmpty() || wanted.contains(childType)) {
                partition.extracted.add(node);
            } else {
                partition.remaining.add(child);
            }
        }
        return partition;
    }

    private Path extractChild(
            ContentNode child,
            int index,
            ExplodeOptions options,
            Path inputPath,
            ObjectNode parentMetadata,
            Set<Path> claimed) throws IOException {

        Path outputPath = pathResolver.resolveOutputPath(
            options.getOutputPattern(),
            PlaceholderContext.of(child, index),
            inputPath.getParent(),
            options.getFormat()
        );

        if (outputPath.equals(inputPath)) {
            throw new CodexException(CodexErrorKind.OUTPUT_EXISTS,
                "Output path collides with the source document: " + outputPath);
        }

        // force only covers files that existed before this run
        if (claimed.contains(outputPath)) {
            throw new CodexException(CodexErrorKind.OUTPUT_EXISTS,
                "Output path already used by another child in this run: " + outputPath);
        }

        if (Files.exists(outputPath) && !options.isForce() && !options.isDryRun()) {
            throw new CodexException(CodexErrorKind.OUTPUT_EXISTS,
                "File already exists: " + outputPath + " (use force option to overwrite)");
        }
        claimed.add(outputPath);

        if (options.isDryRun()) {
            logger.info("[DRY RUN] Would extract: {} -> {}", child.displayName("Untitled"), outputPath);
            return outputPath;
        }

        ContentNode standalone = createStandalone(child, parentMetadata, inputPath);
        fileStore.write(outputPath, standalone, options.getFormat());
        logger.debug("Extracted {} -> {}", child.displayName("Untitled"), outputPath);
        return outputPath;
    }

    /**
     * Standalone document for an extracted child: fresh metadata (inheriting author and
     * license from the parent) plus every child field except its own metadata.
     */
    static ContentNode createStandalone(ContentNode child, ObjectNode parentMetadata, Path parentPath) {
        ObjectNode metadata = JsonNodeFactory.instance.objectNode();
        metadata.put("formatVersion", FORMAT_VERSION);
        metadata.put("documentVersion", DOCUMENT_VERSION);
        metadata.put("created", Instant.now().toString());
        metadata.put("extractedFrom", parentPath.toString());

        if (parentMetadata != null) {
            if (parentMetadata.hasNonNull("author")) {
                metadata.set("author", parentMetadata.get("author").deepCopy());
            }
            if (parentMetadata.hasNonNull("license")) {
                metadata.set("license", parentMetadata.get("license").deepCopy());
            }
        }

        ContentNode standalone = child.withoutMetadata();
        standalone.setMetadata(metadata);

        if (isBlank(standalone.getId())) {
            standalone.setId(UUID.randomUUID().toString());
        }
        if (isBlank(standalone.getType())) {
            standalone.setType("node");
        }
        if (isBlank(standalone.getName()) && isBlank(standalone.getTitle())) {
            standalone.setName("Untitled");
        }
        return standalone;
    }

    /**
     * Extracted children become stubs in their original order; a child that failed
     * (or was skipped by cancellation) stays inline at its position. Non-extracted
     * children follow.
     */
    private List<CodexEntry> replacementChildren(
            Partition partition,
            Map<Integer, Path> extractedByPosition,
            Path parentDir) {

        List<CodexEntry> updated = new ArrayList<>();
        for (int i = 0; i < partition.extracted.size(); i++) {
            Path outputPath = extractedByPosition.get(i);
            if (outputPath != null) {
                updated.add(new IncludeStub(PathResolver.generateIncludePath(outputPath, parentDir)));
            } else {
                updated.add(partition.extracted.get(i));
            }
        }
        updated.addAll(partition.remaining);
        return updated;
    }

    private void markExploded(ContentNode document, ExplodeOptions options, int extractedCount) {
        ObjectNode metadata = document.getMetadata();
        if (metadata == null) {
            metadata = JsonNodeFactory.instance.objectNode();
            document.setMetadata(metadata);
        }
        String now = Instant.now().toString();
        metadata.put("updated", now);

        ObjectNode exploded = metadata.putObject("exploded");
        exploded.put("timestamp", now);
        if (options.extractsAll()) {
            exploded.put("extractedTypes", "all");
        } else {
            ArrayNode types = exploded.putArray("extractedTypes");
            options.getTypes().forEach(types::add);
        }
        exploded.put("extractedCount", extractedCount);
    }

    /**
     * Distinct {@code type} values of the direct inline children, sorted.
     */
    public static List<String> childTypes(ContentNode document) {
        Set<String> types = new TreeSet<>();
        if (document.getChildren() != null) {
            for (CodexEntry child : document.getChildren()) {
                if (child instanceof ContentNode && !isBlank(((ContentNode) child).getType())) {
                    types.add(((ContentNode) child).getType());
                }
            }
        }
        return new ArrayList<>(types);
    }

    public List<String> childTypes(Path documentPath) {
        return childTypes(fileStore.readContent(documentPath));
    }

    private OperationJournal openJournal(Path documentPath) {
        String journalDir = config.getJournalDir();
        return journalDir == null ? new OperationJournal() : new OperationJournal(Paths.get(journalDir), documentPath);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
