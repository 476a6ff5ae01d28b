package im.arun.codex.order;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.ItemFailure;
import im.arun.codex.io.CodexFileStore;
import im.arun.codex.model.DropPosition;
import im.arun.codex.model.IncludeStub;
import im.arun.codex.model.IndexDocument;
import im.arun.codex.model.IndexEntry;
import im.arun.codex.model.IndexNode;
import im.arun.codex.util.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndexReordererTest {

    private static final String INDEX = """
        id: root
        type: index
        name: Project
        children:
          - id: a
            type: chapter
            name: A
            order: 1
          - id: b
            type: chapter
            name: B
            order: 2
          - id: c
            type: chapter
            name: C
            order: 3
          - id: folder
            type: folder
            name: Folder
            order: 4
            children:
              - id: x
                type: chapter
                name: X
                order: 5
          - include: ./sub/index.codex.yaml
        """;

    @TempDir
    Path dir;

    private IndexReorderer reorderer;
    private CodexFileStore store;
    private Path index;

    @BeforeEach
    void setUp() throws IOException {
        reorderer = new IndexReorderer(new CodexConfig());
        store = new CodexFileStore();
        index = dir.resolve("index.codex.yaml");
        Files.writeString(index, INDEX);
    }

    private static List<String> ids(List<IndexEntry> entries) {
        List<String> ids = new ArrayList<>();
        for (IndexEntry entry : entries) {
            ids.add(entry instanceof IndexNode ? ((IndexNode) entry).getId() : "stub");
        }
        return ids;
    }

    private static IndexNode find(IndexDocument document, String id) {
        for (IndexEntry entry : document.getChildren()) {
            if (entry instanceof IndexNode) {
                IndexNode node = (IndexNode) entry;
                if (id.equals(node.getId())) {
                    return node;
                }
                for (IndexNode child : node.childNodes()) {
                    if (id.equals(child.getId())) {
                        return child;
                    }
                }
            }
        }
        return null;
    }

    @Test
    void moveAfterSiblingTakesMidpoint() {
        ReorderResult result = reorderer.reorder(index, List.of("a"), "b", DropPosition.AFTER, new ReorderOptions());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMovedCount()).isEqualTo(1);
        assertThat(result.getNewOrders()).containsEntry("a", 2.5);

        IndexDocument updated = store.readIndex(index);
        assertThat(ids(updated.getChildren())).containsExactly("b", "a", "c", "folder", "stub");
        assertThat(find(updated, "a").getOrder()).isEqualTo(2.5);
        assertThat(find(updated, "c").getOrder()).isEqualTo(3.0);
        assertThat(updated.getChildren().get(4)).isEqualTo(new IncludeStub("./sub/index.codex.yaml"));
        assertThat(Files.exists(dir.resolve("index.codex.yaml.backup"))).isTrue();
    }

    @Test
    void multipleItemsKeepTheirDragOrder() {
        ReorderResult result = reorderer.reorder(index, List.of("c", "a"), "b", DropPosition.BEFORE,
            new ReorderOptions());

        assertThat(result.getMovedCount()).isEqualTo(2);
        IndexDocument updated = store.readIndex(index);
        double c = find(updated, "c").getOrder();
        double a = find(updated, "a").getOrder();
        double b = find(updated, "b").getOrder();
        assertThat(c).isLessThan(a);
        assertThat(a).isLessThan(b);
        assertThat(ids(updated.getChildren()).subList(0, 3)).containsExactly("c", "a", "b");
    }

    @Test
    void insideMovesIntoTargetChildren() {
        ReorderResult result = reorderer.reorder(index, List.of("a"), "folder", DropPosition.INSIDE,
            new ReorderOptions());

        assertThat(result.getMovedCount()).isEqualTo(1);
        IndexDocument updated = store.readIndex(index);
        assertThat(ids(updated.getChildren())).containsExactly("b", "c", "folder", "stub");
        IndexNode folder = find(updated, "folder");
        assertThat(ids(folder.getChildren())).containsExactly("a", "x");
        assertThat(folder.childNodes().get(0).getOrder()).isEqualTo(4.0);
    }

    @Test
    void invalidItemsFailIndividually() {
        ReorderResult result = reorderer.reorder(index, List.of("folder", "ghost", "b", "c"), "x",
            DropPosition.AFTER, new ReorderOptions());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMovedCount()).isEqualTo(2);
        assertThat(result.getFailures()).extracting(ItemFailure::getKind)
            .containsExactly(CodexErrorKind.INVALID_MOVE, CodexErrorKind.NODE_NOT_FOUND);
        assertThat(result.getErrors()).contains("2 succeeded, 2 failed");

        IndexDocument updated = store.readIndex(index);
        assertThat(ids(find(updated, "folder").getChildren())).containsExactly("x", "b", "c");
    }

    @Test
    void droppingOntoItselfIsRejected() {
        ReorderResult result = reorderer.reorder(index, List.of("b"), "b", DropPosition.AFTER, new ReorderOptions());

        assertThat(result.getMovedCount()).isZero();
        assertThat(result.getFailures()).singleElement()
            .extracting(ItemFailure::getKind).isEqualTo(CodexErrorKind.INVALID_MOVE);
        assertThat(Files.exists(dir.resolve("index.codex.yaml.backup"))).isFalse();
    }

    @Test
    void repeatedItemIsRejectedAndNothingIsLost() {
        ReorderResult result = reorderer.reorder(index, List.of("a", "a"), "b", DropPosition.AFTER,
            new ReorderOptions());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMovedCount()).isEqualTo(1);
        assertThat(result.getFailures()).singleElement()
            .extracting(ItemFailure::getKind).isEqualTo(CodexErrorKind.INVALID_MOVE);

        IndexDocument updated = store.readIndex(index);
        assertThat(ids(updated.getChildren())).containsExactly("b", "a", "c", "folder", "stub");
        assertThat(find(updated, "a").getOrder()).isEqualTo(2.5);
    }

    @Test
    void anchorInsideMovedItemIsRejectedWithoutDroppingIt() {
        ReorderResult result = reorderer.reorder(index, List.of("a", "folder"), "x", DropPosition.AFTER,
            new ReorderOptions());

        assertThat(result.getMovedCount()).isEqualTo(1);
        assertThat(result.getFailures()).singleElement()
            .extracting(ItemFailure::getKind).isEqualTo(CodexErrorKind.INVALID_MOVE);

        IndexDocument updated = store.readIndex(index);
        assertThat(ids(updated.getChildren())).containsExactly("b", "c", "folder", "stub");
        assertThat(ids(find(updated, "folder").getChildren())).containsExactly("x", "a");
    }

    @Test
    void unknownTargetFailsTheWholeOperation() {
        ReorderResult result = reorderer.reorder(index, List.of("a"), "nope", DropPosition.AFTER, new ReorderOptions());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailures().get(0).getKind()).isEqualTo(CodexErrorKind.STRUCTURE_ERROR);
    }

    @Test
    void dryRunComputesWithoutWriting() throws IOException {
        ReorderOptions options = new ReorderOptions();
        options.setDryRun(true);

        ReorderResult result = reorderer.reorder(index, List.of("c"), "a", DropPosition.BEFORE, options);

        assertThat(result.getNewOrders()).containsEntry("c", 0.0);
        assertThat(Files.readString(index)).isEqualTo(INDEX);
    }

    @Test
    void crowdedSiblingsAreRenumbered() throws IOException {
        Files.writeString(index, """
            type: index
            children:
              - {id: a, type: chapter, name: A}
              - {id: b, type: chapter, name: B}
              - {id: c, type: chapter, name: C}
            """);

        ReorderResult result = reorderer.reorder(index, List.of("c"), "a", DropPosition.AFTER, new ReorderOptions());

        assertThat(result.isRenumbered()).isTrue();
        IndexDocument updated = store.readIndex(index);
        assertThat(ids(updated.getChildren())).containsExactly("a", "c", "b");
        assertThat(find(updated, "a").getOrder()).isEqualTo(1.0);
        assertThat(find(updated, "c").getOrder()).isEqualTo(1.5);
        assertThat(find(updated, "b").getOrder()).isEqualTo(2.0);
    }

    @Test
    void cancellationSkipsRemainingItems() {
        CancellationToken token = new CancellationToken();

        ReorderResult result = reorderer.reorder(index, List.of("a", "c"), "folder", DropPosition.AFTER,
            new ReorderOptions(), (done, total, message) -> token.cancel(), token);

        assertThat(result.getMovedCount()).isEqualTo(1);
        assertThat(result.getErrors()).anyMatch(error -> error.contains("cancelled"));
    }
}
