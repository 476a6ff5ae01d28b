package im.arun.codex.order;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.io.CodexFileStore;
import im.arun.codex.model.DropPosition;
import im.arun.codex.model.IndexDocument;
import im.arun.codex.model.IndexEntry;
import im.arun.codex.model.IndexNode;
import im.arun.codex.util.BatchOutcome;
import im.arun.codex.util.BatchProcessor;
import im.arun.codex.util.CancellationToken;
import im.arun.codex.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Drag-and-drop reordering inside one index file.
 * <p>
 * The first dragged item lands relative to the drop target; every following item is
 * placed right after the one before it, so a multi-selection keeps its order. Items
 * are moved one at a time and a failing item does not stop the rest.
 */
public class IndexReorderer {
    private static final Logger logger = LoggerFactory.getLogger(IndexReorderer.class);

    private final OrderCalculator calculator;
    private final CodexFileStore fileStore;

    public IndexReorderer(CodexConfig config) {
        this(new OrderCalculator(config), new CodexFileStore());
    }

    public IndexReorderer(OrderCalculator calculator, CodexFileStore fileStore) {
        this.calculator = calculator;
        this.fileStore = fileStore;
    }

    /**
     * Where a node lives: the list holding it.
     */
    private static final class Location {
        final List<IndexEntry> container;
        final IndexNode node;

        Location(List<IndexEntry> container, IndexNode node) {
            this.container = container;
            this.node = node;
        }
    }

    public ReorderResult reorder(Path indexFile, List<String> itemIds, String targetId,
                                 DropPosition position, ReorderOptions options) {
        return reorder(indexFile, itemIds, targetId, position, options,
            ProgressListener.NONE, CancellationToken.none());
    }

    public ReorderResult reorder(
            Path indexFile,
            List<String> itemIds,
            String targetId,
            DropPosition position,
            ReorderOptions options,
            ProgressListener progress,
            CancellationToken cancellation) {

        Path indexPath = indexFile.toAbsolutePath().normalize();
        IndexDocument document;
        try {
            document = fileStore.readIndex(indexPath);
        } catch (CodexException e) {
            logger.error("Cannot reorder {}: {}", indexPath, e.getMessage());
            return ReorderResult.failure(e);
        }

        if (!document.isIndexType()) {
            return ReorderResult.failure(new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "Not an index document (type: " + document.getType() + "): " + indexPath));
        }
        if (document.getChildren() == null) {
            document.setChildren(new ArrayList<>());
        }

        List<IndexEntry> roots = document.getChildren();
        if (locate(roots, targetId) == null) {
            return ReorderResult.failure(new CodexException(CodexErrorKind.STRUCTURE_ERROR,
                "Drop target '" + targetId + "' not found in " + indexPath));
        }

        ReorderResult result = new ReorderResult();
        result.setDryRun(options.isDryRun());
        IndexNode[] previous = new IndexNode[1];
        Set<String> seen = new HashSet<>();

        logger.info("{} {} item(s) {} '{}' in {}",
            position == DropPosition.INSIDE ? "Moving" : "Reordering",
            itemIds.size(), position.name().toLowerCase(Locale.ROOT), targetId, indexPath);

        BatchOutcome<String, Double> outcome = BatchProcessor.fold(
            itemIds,
            id -> id,
            (itemId, index) -> {
                if (!seen.add(itemId)) {
                    throw new CodexException(CodexErrorKind.INVALID_MOVE,
                        "Item '" + itemId + "' is listed more than once");
                }
                IndexNode anchor = previous[0] != null ? previous[0] : locate(roots, targetId).node;
                DropPosition anchorPosition = previous[0] != null ? DropPosition.AFTER : position;
                IndexNode moved = moveItem(roots, itemId, targetId, anchor, anchorPosition, result);
                previous[0] = moved;
                return moved.getOrder();
            },
            progress,
            cancellation
        );

        result.setSuccess(true);
        for (BatchOutcome.Success<String, Double> success : outcome.getSuccesses()) {
            result.getNewOrders().put(success.item, success.value);
        }
        result.setMovedCount(outcome.getSuccesses().size());
        result.getFailures().addAll(outcome.itemFailures());
        result.getErrors().addAll(outcome.failureMessages());
        if (outcome.hasFailures() || outcome.isCancelled()) {
            result.getErrors().add(outcome.summary());
        }

        if (options.isDryRun() || result.getMovedCount() == 0) {
            return result;
        }

        try {
            if (options.isBackup()) {
                result.setBackupFile(fileStore.backup(indexPath).toString());
            }
            fileStore.write(indexPath, document, fileStore.formatOf(indexPath));
        } catch (IOException e) {
            String message = "Failed to write index file " + indexPath + ": " + e.getMessage();
            logger.error(message, e);
            result.setSuccess(false);
            result.getErrors().add(0, message);
            return result;
        }

        logger.info("Reordered {} item(s) in {}", result.getMovedCount(), indexPath);
        return result;
    }

    private IndexNode moveItem(List<IndexEntry> roots, String itemId, String targetId,
                               IndexNode anchor, DropPosition position, ReorderResult result) {
        if (itemId.equals(targetId)) {
            throw new CodexException(CodexErrorKind.INVALID_MOVE, "Cannot drop '" + itemId + "' onto itself");
        }
        Location item = locate(roots, itemId);
        if (item == null) {
            throw new CodexException(CodexErrorKind.NODE_NOT_FOUND, "Item '" + itemId + "' not found");
        }
        if (locate(item.node.getChildren(), targetId) != null
                || locate(item.node.getChildren(), anchor.getId()) != null) {
            throw new CodexException(CodexErrorKind.INVALID_MOVE,
                "Cannot move '" + itemId + "' into its own descendant '" + targetId + "'");
        }

        int oldIndex = identityIndex(item.container, item.node);
        item.container.remove(oldIndex);
        try {
            return place(roots, item, anchor, position, result);
        } catch (RuntimeException e) {
            // the node must never leave the document on a failed move
            int stray = identityIndex(item.container, item.node);
            if (stray < 0) {
                item.container.add(Math.min(oldIndex, item.container.size()), item.node);
            }
            throw e;
        }
    }

    private IndexNode place(List<IndexEntry> roots, Location item, IndexNode anchor,
                            DropPosition position, ReorderResult result) {
        String itemId = item.node.getId();
        OrderCalculator.Placement placement;
        if (position == DropPosition.INSIDE) {
            placement = calculator.place(anchor, DropPosition.INSIDE, anchor.childNodes());
            if (anchor.getChildren() == null) {
                anchor.setChildren(new ArrayList<>());
            }
            anchor.getChildren().add(0, item.node);
        } else {
            Location anchorLocation = locate(roots, anchor.getId());
            List<IndexEntry> container = anchorLocation != null ? anchorLocation.container : roots;
            placement = calculator.place(anchor, position, nodesOf(container));
            int anchorIndex = identityIndex(container, anchor);
            container.add(position == DropPosition.BEFORE ? anchorIndex : anchorIndex + 1, item.node);
        }

        item.node.setOrder(placement.getOrder());
        if (placement.isRenumbered()) {
            result.setRenumbered(true);
        }
        logger.debug("Item '{}' placed {} '{}' with order {}",
            itemId, position.name().toLowerCase(Locale.ROOT), anchor.getId(), placement.getOrder());
        return item.node;
    }

    private static List<IndexNode> nodesOf(List<IndexEntry> entries) {
        List<IndexNode> nodes = new ArrayList<>();
        for (IndexEntry entry : entries) {
            if (entry instanceof IndexNode) {
                nodes.add((IndexNode) entry);
            }
        }
        return nodes;
    }

    private static Location locate(List<IndexEntry> entries, String id) {
        if (entries == null || id == null) {
            return null;
        }
        for (IndexEntry entry : entries) {
            if (entry instanceof IndexNode) {
                IndexNode node = (IndexNode) entry;
                if (id.equals(node.getId())) {
                    return new Location(entries, node);
                }
                Location nested = locate(node.getChildren(), id);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    /**
     * Index of {@code node} by identity; nodes with equal fields are distinct entries.
     */
    private static int identityIndex(List<IndexEntry> entries, IndexNode node) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == node) {
                return i;
            }
        }
        return -1;
    }
}
