package im.arun.codex.index;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.io.CodexFileStore;
import im.arun.codex.model.Attribute;
import im.arun.codex.model.IncludeStub;
import im.arun.codex.model.IndexDocument;
import im.arun.codex.model.IndexEntry;
import im.arun.codex.model.IndexNode;
import im.arun.codex.path.PathResolver;
import im.arun.codex.path.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Composes a forest of per-folder index files into one navigation tree.
 * <p>
 * Include stubs naming a canonical index file are loaded as sub-indexes and become
 * folder nodes; any other include becomes a leaf document node built from the file
 * name alone. Every sub-index path is visited at most once per resolution, so self
 * and mutual inclusion end in a warning instead of recursing.
 */
public class IndexResolver {
    private static final Logger logger = LoggerFactory.getLogger(IndexResolver.class);

    static final String FOLDER_TYPE = "folder";
    static final String DOCUMENT_TYPE = "document";

    private final CodexConfig config;
    private final PathResolver pathResolver;
    private final CodexFileStore fileStore;

    public IndexResolver(CodexConfig config) {
        this(config, new PathResolver(config), new CodexFileStore());
    }

    public IndexResolver(CodexConfig config, PathResolver pathResolver, CodexFileStore fileStore) {
        this.config = config;
        this.pathResolver = pathResolver;
        this.fileStore = fileStore;
    }

    /**
     * Reads and resolves the index file at {@code indexFile}.
     */
    public IndexResolution resolve(Path indexFile) {
        Path indexPath = indexFile.toAbsolutePath().normalize();
        String content;
        try {
            content = fileStore.readText(indexPath);
        } catch (CodexException e) {
            logger.error("Cannot read index {}: {}", indexPath, e.getMessage());
            return IndexResolution.failure(e);
        }
        return resolve(content, indexPath.getParent(), indexPath);
    }

    /**
     * Resolves raw index text whose includes are relative to {@code indexDir}.
     */
    public IndexResolution resolve(String content, Path indexDir) {
        return resolve(content, indexDir, null);
    }

    public IndexResolution resolve(String content, Path indexDir, Path indexPath) {
        IndexDocument document;
        try {
            document = fileStore.parseIndex(content);
        } catch (CodexException e) {
            logger.error("Failed to parse index file: {}", e.getMessage());
            return IndexResolution.failure(e);
        }

        if (!document.isIndexType()) {
            return IndexResolution.failure(new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "Not an index document (type: " + document.getType() + ")"));
        }

        Path baseDir = indexDir.toAbsolutePath().normalize();
        Path root = config.getProjectRoot() != null ? Paths.get(config.getProjectRoot()) : baseDir;
        ResolutionContext context = ResolutionContext.start(baseDir, root, indexPath);

        IndexResolution resolution = new IndexResolution();
        resolution.setSuccess(true);
        resolution.setDocument(document);

        if (document.getChildren() != null) {
            document.setChildren(resolveChildren(document.getChildren(), context, resolution));
            TypeStyleApplier.applyTypeStyles(document.getChildren(), document.getTypeStyles());
            TypeStyleApplier.applyDefaultStatus(document.getChildren(), config.getDefaultStatus());
            linkParents(document.getChildren(), null);
        }

        logger.info("Resolved index {}: {} sub-indexes, {} leaf includes, {} warnings",
            indexPath != null ? indexPath : baseDir,
            resolution.getSubIndexCount(), resolution.getLeafIncludeCount(), resolution.getErrors().size());
        return resolution;
    }

    private List<IndexEntry> resolveChildren(List<IndexEntry> children, ResolutionContext context,
                                             IndexResolution resolution) {
        List<IndexEntry> resolved = new ArrayList<>();

        for (IndexEntry child : children) {
            if (child instanceof IncludeStub) {
                String includePath = ((IncludeStub) child).getInclude();
                try {
                    IndexNode node = CodexFileStore.isIndexFile(includePath)
                        ? resolveSubIndex(includePath, context, resolution)
                        : leafNode(includePath, context, resolution);
                    if (node != null) {
                        resolved.add(node);
                    }
                } catch (CodexException e) {
                    logger.warn("Skipping include '{}': {}", includePath, e.getMessage());
                    resolution.warn(includePath, e);
                }
            } else if (child instanceof IndexNode) {
                resolved.add(resolveInline((IndexNode) child, context, resolution));
            }
        }

        return resolved;
    }

    /**
     * Loads a sub-index and turns it into a folder node. Returns null for a circular
     * reference, which is recorded but not thrown.
     */
    private IndexNode resolveSubIndex(String includePath, ResolutionContext context, IndexResolution resolution) {
        Path subIndexPath = pathResolver.resolveIncludePath(includePath, context.getBaseDir(), context.getRoot());

        if (context.isVisited(subIndexPath)) {
            logger.warn("Circular sub-index reference detected: {}", subIndexPath);
            resolution.warn(includePath, new CodexException(CodexErrorKind.CIRCULAR_REFERENCE,
                "Circular sub-index reference detected: " + subIndexPath));
            return null;
        }
        if (!Files.isRegularFile(subIndexPath)) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE, "Sub-index not found: " + subIndexPath);
        }
        if (context.getDepth() >= config.getMaxIncludeDepth()) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE,
                "Include depth limit (" + config.getMaxIncludeDepth() + ") reached at " + subIndexPath);
        }

        // Marked before parsing so a self-include inside this very file is caught
        context.markVisited(subIndexPath);

        IndexDocument subIndex;
        try {
            subIndex = fileStore.readIndex(subIndexPath);
        } catch (CodexException e) {
            throw new CodexException(CodexErrorKind.UNRESOLVED_INCLUDE,
                "Failed to load sub-index " + subIndexPath + ": " + e.getMessage(), e);
        }

        Path subIndexDir = subIndexPath.getParent();
        String dirName = subIndexDir.getFileName() != null ? subIndexDir.getFileName().toString() : "";

        IndexNode folder = new IndexNode(
            isBlank(subIndex.getId()) ? dirName : subIndex.getId(),
            FOLDER_TYPE,
            isBlank(subIndex.getName()) ? dirName : subIndex.getName());
        // The directory name, not the display name, so composed paths match the disk layout
        folder.setFilename(dirName);
        folder.setSubIndexPath(PathResolver.relativePosix(context.getRoot(), subIndexPath));
        folder.setComputedPath(PathResolver.relativePosix(context.getRoot(), subIndexDir));

        if (!isBlank(subIndex.getSummary())) {
            folder.setTitle(subIndex.getSummary());
        }
        if (!isBlank(subIndex.getEmoji())) {
            folder.setEmoji(subIndex.getEmoji());
        }
        if (!isBlank(subIndex.getScrivenerLabel())) {
            List<Attribute> attributes = new ArrayList<>();
            attributes.add(new Attribute("scrivener_label", subIndex.getScrivenerLabel()));
            folder.setAttributes(attributes);
        }

        if (subIndex.getChildren() != null) {
            folder.setChildren(resolveChildren(subIndex.getChildren(), context.enter(subIndexPath), resolution));
            // The sub-index's own styles win inside its subtree
            TypeStyleApplier.applyTypeStyles(folder.getChildren(), subIndex.getTypeStyles());
        }

        resolution.setSubIndexCount(resolution.getSubIndexCount() + 1);
        logger.debug("Merged sub-index {} as folder '{}'", subIndexPath, folder.getName());
        return folder;
    }

    /**
     * Document node synthesized from the include's file name; the file is not read.
     */
    private IndexNode leafNode(String includePath, ResolutionContext context, IndexResolution resolution) {
        Path target = pathResolver.resolveIncludePath(includePath, context.getBaseDir(), context.getRoot());
        String fileName = target.getFileName() != null ? target.getFileName().toString() : includePath;
        String baseName = baseName(fileName);

        IndexNode node = new IndexNode("file-" + baseName, DOCUMENT_TYPE, humanize(baseName));
        node.setFilename(fileName);
        node.setIncludedFrom(includePath);
        node.setFormat(formatOf(fileName));
        node.setComputedPath(PathResolver.relativePosix(context.getRoot(), target));

        resolution.setLeafIncludeCount(resolution.getLeafIncludeCount() + 1);
        return node;
    }

    /**
     * Copies an inline node and resolves its children against the directory of its
     * {@code _filename}, if it has one.
     */
    private IndexNode resolveInline(IndexNode node, ResolutionContext context, IndexResolution resolution) {
        if (node.getFilename() != null && node.getComputedPath() == null) {
            node.setComputedPath(PathResolver.relativePosix(context.getRoot(),
                context.getBaseDir().resolve(node.getFilename())));
        }
        if (node.getChildren() == null) {
            return node;
        }

        ResolutionContext childContext = context;
        if (node.getFilename() != null) {
            Path filenameDir = Paths.get(node.getFilename()).getParent();
            if (filenameDir != null) {
                childContext = context.withBaseDir(context.getBaseDir().resolve(filenameDir));
            }
        }
        node.setChildren(resolveChildren(node.getChildren(), childContext, resolution));
        return node;
    }

    private static void linkParents(List<IndexEntry> entries, IndexNode parent) {
        for (IndexEntry entry : entries) {
            if (entry instanceof IndexNode) {
                IndexNode node = (IndexNode) entry;
                node.setParent(parent);
                if (node.getChildren() != null) {
                    linkParents(node.getChildren(), node);
                }
            }
        }
    }

    /**
     * File name without its extension; a trailing {@code .codex} is dropped as well.
     */
    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        if (base.toLowerCase(Locale.ROOT).endsWith(".codex")) {
            base = base.substring(0, base.length() - ".codex".length());
        }
        return base;
    }

    /**
     * {@code my-first-chapter} becomes {@code My First Chapter}.
     */
    static String humanize(String baseName) {
        String spaced = baseName.replace('-', ' ');
        StringBuilder result = new StringBuilder(spaced.length());
        boolean startOfWord = true;
        for (char c : spaced.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '_') {
                result.append(startOfWord ? Character.toUpperCase(c) : c);
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return result.toString();
    }

    static String formatOf(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".md")) {
            return "markdown";
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return "yaml";
        }
        return "json";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
