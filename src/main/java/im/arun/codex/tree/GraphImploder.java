package im.arun.codex.tree;

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
import im.arun.codex.path.ResolutionContext;
import im.arun.codex.util.BatchOutcome;
import im.arun.codex.util.BatchProcessor;
import im.arun.codex.util.CancellationToken;
import im.arun.codex.util.OperationJournal;
import im.arun.codex.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves include stubs of a content document back into inline nodes.
 * <p>
 * A stub that cannot be resolved is kept as it is and reported; only a missing or
 * malformed parent document fails the whole call.
 */
public class GraphImploder {
    private static final Logger logger = LoggerFactory.getLogger(GraphImploder.class);

    private final CodexConfig config;
    private final PathResolver pathResolver;
    private final CodexFileStore fileStore;

    public GraphImploder(CodexConfig config) {
        this(config, new PathResolver(config), new CodexFileStore());
    }

    public GraphImploder(CodexConfig config, PathResolver pathResolver, CodexFileStore fileStore) {
        this.config = config;
        this.pathResolver = pathResolver;
        this.fileStore = fileStore;
    }

    /**
     * Accumulates what one implode pass merged and what went wrong below the top level.
     */
    private static class ImplodeRun {
        final ImplodeOptions options;
        final Set<Path> mergedFiles = new LinkedHashSet<>();
        final List<ItemFailure> nestedFailures = new ArrayList<>();

        ImplodeRun(ImplodeOptions options) {
            this.options = options;
        }
    }

    public ImplodeResult implode(Path documentPath, ImplodeOptions options) {
        return implode(documentPath, options, ProgressListener.NONE, CancellationToken.none());
    }

    public ImplodeResult implode(
            Path documentPath,
            ImplodeOptions options,
            ProgressListener progress,
            CancellationToken cancellation) {

        Path inputPath = documentPath.toAbsolutePath().normalize();
        OperationJournal journal = openJournal(inputPath);
        journal.info("Starting implode", Map.of(
            "document", inputPath.toString(),
            "recursive", options.isRecursive(),
            "dryRun", options.isDryRun()
        ));

        ContentNode document;
        CodexFormat parentFormat;
        try {
            document = fileStore.readContent(inputPath);
            parentFormat = fileStore.formatOf(inputPath);
        } catch (CodexException e) {
            logger.error("Cannot implode {}: {}", inputPath, e.getMessage());
            journal.error(e.getMessage());
            return ImplodeResult.failure(e);
        }

        if (!document.hasChildren()) {
            CodexException e = new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "No 'children' array found in codex file: " + inputPath);
            logger.error(e.getMessage());
            journal.error(e.getMessage());
            return ImplodeResult.failure(e);
        }

        int includeCount = includeCount(document, options.isRecursive());
        logger.info("Imploding {}: {} include directives", inputPath, includeCount);
        if (includeCount == 0) {
            return ImplodeResult.nothingToDo("No include directives found - nothing to merge", options.isDryRun());
        }

        Path parentDir = inputPath.getParent();
        Path root = config.getProjectRoot() != null ? Paths.get(config.getProjectRoot()) : parentDir;
        ResolutionContext context = ResolutionContext.start(parentDir, root, inputPath);
        ImplodeRun run = new ImplodeRun(options);

        List<CodexEntry> children = document.getChildren();
        BatchOutcome<CodexEntry, CodexEntry> outcome = BatchProcessor.fold(
            children,
            GraphImploder::label,
            (child, index) -> resolveEntry(child, context, run),
            progress,
            cancellation
        );

        Map<Integer, CodexEntry> resolvedByPosition = new HashMap<>();
        for (BatchOutcome.Success<CodexEntry, CodexEntry> success : outcome.getSuccesses()) {
            resolvedByPosition.put(success.position, success.value);
        }
        List<CodexEntry> resolvedChildren = new ArrayList<>();
        for (int i = 0; i < children.size(); i++) {
            resolvedChildren.add(resolvedByPosition.getOrDefault(i, children.get(i)));
        }

        ImplodeResult result = new ImplodeResult();
        result.setSuccess(true);
        result.setDryRun(options.isDryRun());
        result.getFailures().addAll(outcome.itemFailures());
        result.getFailures().addAll(run.nestedFailures);
        for (ItemFailure failure : result.getFailures()) {
            result.getErrors().add(failure.getMessage());
        }
        if (outcome.isCancelled()) {
            result.getErrors().add("Implode cancelled: " + outcome.summary());
        }
        for (Path merged : run.mergedFiles) {
            result.getMergedFiles().add(merged.toString());
        }
        result.setMergedCount(result.getMergedFiles().size());

        if (options.isDryRun()) {
            if (options.isDeleteSourceFiles()) {
                result.getDeletedFiles().addAll(result.getMergedFiles());
            }
            logger.info("[DRY RUN] Would merge {} files into {}", result.getMergedCount(), inputPath);
            return result;
        }

        if (run.mergedFiles.isEmpty()) {
            logger.warn("No include of {} could be resolved, document left unchanged", inputPath);
            return result;
        }

        document.setChildren(resolvedChildren);
        markImploded(document, result.getMergedCount());

        try {
            if (options.isBackup()) {
                result.setBackupFile(fileStore.backup(inputPath).toString());
            }
            fileStore.write(inputPath, document, parentFormat);
        } catch (IOException e) {
            String message = "Failed to update parent file " + inputPath + ": " + e.getMessage();
            logger.error(message, e);
            journal.error(message);
            result.setSuccess(false);
            result.getFailures().add(0, new ItemFailure("document", CodexErrorKind.IO_ERROR, message));
            result.getErrors().add(0, message);
            return result;
        }

        if (options.isDeleteSourceFiles()) {
            deleteSourceFiles(run.mergedFiles, parentDir, options.isDeleteEmptyFolders(), result);
        }

        logger.info("Merged {} files into {}", result.getMergedCount(), inputPath);
        journal.info("Implode complete", Map.of(
            "merged", result.getMergedCount(),
            "failed", result.getFailures().size(),
            "deletedFiles", result.getDeletedFiles().size()
        ));
        return result;
    }

    private List<CodexEntry> resolveEntries(List<CodexEntry> entries, ResolutionContext context, ImplodeRun run) {
        List<CodexEntry> resolved = new ArrayList<>();
        for (CodexEntry entry : entries) {
            try {
                resolved.add(resolveEntry(entry, context, run));
            } catch (CodexException e) {
                logger.warn("Keeping unresolved include {}: {}", label(entry), e.getMessage());
                run.nestedFailures.add(ItemFailure.of(label(entry), e));
                resolved.add(entry);
            }
        }
        return resolved;
    }

    /**
     * Resolves one children element. Throws {@link CodexException} when the element is
     * a stub that cannot be resolved; the caller keeps the stub.
     */
    private CodexEntry resolveEntry(CodexEntry entry, ResolutionContext context, ImplodeRun run) {
        if (entry instanceof IncludeStub) {
            return resolveStub((IncludeStub) entry, context, run);
        }

        if (entry instanceof ContentNode && run.options.isRecursive() && ((ContentNode) entry).hasChildren()) {
            ContentNode node = (ContentNode) entry;
            ContentNode copy = node.withoutMetadata();
            copy.setMetadata(node.getMetadata());
            copy.setChildren(resolveEntries(node.getChildren(), context, run));
            return copy;
        }
        return entry;
    }

    private ContentNode resolveStub(IncludeStub stub, ResolutionContext context, ImplodeRun run) {
        String includePath = stub.getInclude();
        Path fullPath;
        try {
            fullPath = pathResolver.resolveIncludePath(includePath, context.getBaseDir(), context.getRoot());
        } catch (CodexException e) {
            throw new CodexException(e.getKind(),
                "Failed to resolve include \"" + includePath + "\": " + e.getMessage(), e);
        }

        if (!Files.isRegularFile(fullPath)) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE, "Include file not found: " + fullPath);
        }
        if (!CodexFileStore.isCodexFile(fullPath)) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE,
                "Include is not a valid codex file: " + fullPath);
        }
        if (context.isVisited(fullPath)) {
            throw new CodexException(CodexErrorKind.CIRCULAR_REFERENCE,
                "Circular include detected: " + fullPath);
        }
        if (context.getDepth() >= config.getMaxIncludeDepth()) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE,
                "Include depth limit (" + config.getMaxIncludeDepth() + ") reached at " + fullPath);
        }

        ContentNode included;
        try {
            included = fileStore.readContent(fullPath);
        } catch (CodexException e) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE,
                "Failed to parse include file \"" + fullPath + "\": " + e.getMessage(), e);
        }

        run.mergedFiles.add(fullPath);
        logger.debug("Resolved include: {} -> {}", includePath, fullPath);

        // Standalone metadata does not belong in the merged tree
        ContentNode entity = included.withoutMetadata();

        if (run.options.isRecursive() && entity.hasChildren()) {
            entity.setChildren(resolveEntries(entity.getChildren(), context.branch(fullPath), run));
        }
        return entity;
    }

    private void markImploded(ContentNode document, int mergedCount) {
        ObjectNode metadata = document.getMetadata();
        if (metadata == null) {
            metadata = JsonNodeFactory.instance.objectNode();
            document.setMetadata(metadata);
        }
        String now = Instant.now().toString();
        metadata.put("updated", now);
        metadata.remove("exploded");

        ObjectNode imploded = metadata.putObject("imploded");
        imploded.put("timestamp", now);
        imploded.put("mergedCount", mergedCount);
    }

    private void deleteSourceFiles(Set<Path> mergedFiles, Path documentDir, boolean deleteEmptyFolders,
                                   ImplodeResult result) {
        Set<Path> foldersToCheck = new LinkedHashSet<>();

        for (Path file : mergedFiles) {
            try {
                if (Files.deleteIfExists(file)) {
                    result.getDeletedFiles().add(file.toString());
                    collectCandidateFolders(file.getParent(), documentDir, foldersToCheck);
                }
            } catch (IOException e) {
                String message = "Failed to delete file \"" + file + "\": " + e.getMessage();
                logger.warn(message);
                result.getFailures().add(new ItemFailure(file.toString(), CodexErrorKind.IO_ERROR, message));
                result.getErrors().add(message);
            }
        }

        if (!deleteEmptyFolders) {
            return;
        }

        // Deepest first so nested empty folders go before their parents
        List<Path> sortedFolders = new ArrayList<>(foldersToCheck);
        sortedFolders.sort(Comparator.comparingInt(Path::getNameCount).reversed());

        for (Path folder : sortedFolders) {
            try {
                if (Files.isDirectory(folder) && isEmptyDirectory(folder)) {
                    Files.delete(folder);
                    result.getDeletedFolders().add(folder.toString());
                    logger.info("Deleted empty folder: {}", folder);
                }
            } catch (IOException e) {
                logger.warn("Could not delete folder \"{}\": {}", folder, e.getMessage());
            }
        }
    }

    /**
     * The folder itself plus its ancestors strictly below the document's directory.
     */
    private static void collectCandidateFolders(Path folder, Path documentDir, Set<Path> candidates) {
        if (folder == null || folder.equals(documentDir)) {
            return;
        }
        candidates.add(folder);
        Path current = folder.getParent();
        while (current != null && current.startsWith(documentDir) && !current.equals(documentDir)) {
            candidates.add(current);
            current = current.getParent();
        }
    }

    private static boolean isEmptyDirectory(Path folder) throws IOException {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(folder)) {
            return !entries.iterator().hasNext();
        }
    }

    /**
     * Include directives among the direct children, in order.
     */
    public static List<String> includePaths(ContentNode document) {
        List<String> paths = new ArrayList<>();
        if (document.getChildren() != null) {
            for (CodexEntry child : document.getChildren()) {
                if (child instanceof IncludeStub) {
                    paths.add(((IncludeStub) child).getInclude());
                }
            }
        }
        return paths;
    }

    /**
     * Number of stubs among the direct children, or in the whole inline tree when
     * {@code recursive} is set.
     */
    public static int includeCount(ContentNode document, boolean recursive) {
        return countIncludes(document.getChildren(), recursive);
    }

    private static int countIncludes(List<CodexEntry> entries, boolean recursive) {
        int count = 0;
        if (entries == null) {
            return count;
        }
        for (CodexEntry entry : entries) {
            if (entry instanceof IncludeStub) {
                count++;
            } else if (recursive && entry instanceof ContentNode) {
                count += countIncludes(((ContentNode) entry).getChildren(), true);
            }
        }
        return count;
    }

    private static String label(CodexEntry entry) {
        if (entry instanceof IncludeStub) {
            return ((IncludeStub) entry).getInclude();
        }
        if (entry instanceof ContentNode) {
            return ((ContentNode) entry).displayName("Untitled");
        }
        return String.valueOf(entry);
    }

    private OperationJournal openJournal(Path documentPath) {
        String journalDir = config.getJournalDir();
        return journalDir == null ? new OperationJournal() : new OperationJournal(Paths.get(journalDir), documentPath);
    }
}
