package im.arun.codex.io;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.model.CodexEntry;
import im.arun.codex.model.ContentNode;
import im.arun.codex.model.IncludeStub;
import im.arun.codex.model.IndexDocument;
import im.arun.codex.model.IndexNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodexFileStoreTest {

    private final CodexFileStore store = new CodexFileStore();

    @Test
    void stubsAreRecognisedByShapeOnly() {
        ContentNode document = store.parseContent("""
            id: doc
            type: book
            name: Doc
            children:
              - include: /a.codex.yaml
              - include: /b.codex.yaml
                name: not a stub, has a second key
              - include: 42
              - id: plain
                type: chapter
                name: Plain
            """, CodexFormat.YAML);

        List<CodexEntry> children = document.getChildren();
        assertThat(children.get(0)).isEqualTo(new IncludeStub("/a.codex.yaml"));
        assertThat(children.get(1)).isInstanceOf(ContentNode.class);
        assertThat(((ContentNode) children.get(1)).getName()).isEqualTo("not a stub, has a second key");
        assertThat(children.get(2)).isInstanceOf(ContentNode.class);
        assertThat(children.get(3)).isInstanceOf(ContentNode.class);
    }

    @Test
    void unknownFieldsSurviveAWriteCycle(@TempDir Path dir) throws Exception {
        ContentNode document = store.parseContent("""
            {"id": "doc", "type": "book", "name": "Doc", "wordCount": 1200,
             "attributes": [{"key": "genre", "value": "noir", "source": "import"}],
             "children": [{"id": "c", "type": "chapter", "name": "C", "draft": true}]}
            """, null);
        Path file = dir.resolve("doc.codex.yaml");

        store.write(file, document, CodexFormat.YAML);
        ContentNode reread = store.readContent(file);

        assertThat(reread).isEqualTo(document);
        JsonNode tree = store.toTree(reread);
        assertThat(tree.get("wordCount").asInt()).isEqualTo(1200);
        assertThat(tree.get("attributes").get(0).get("source").asText()).isEqualTo("import");
        assertThat(tree.get("children").get(0).get("draft").asBoolean()).isTrue();
    }

    @Test
    void indexNodesReadComputedFields() {
        IndexDocument index = store.parseIndex("""
            type: index
            scrivener_label: Chapter
            children:
              - id: a
                type: chapter
                name: A
                order: 1.5
                _filename: a.codex.yaml
                _computed_path: book/a.codex.yaml
              - include: ./sub/index.codex.yaml
            """);

        assertThat(index.isIndexType()).isTrue();
        assertThat(index.getScrivenerLabel()).isEqualTo("Chapter");
        IndexNode a = (IndexNode) index.getChildren().get(0);
        assertThat(a.getOrder()).isEqualTo(1.5);
        assertThat(a.getFilename()).isEqualTo("a.codex.yaml");
        assertThat(a.getComputedPath()).isEqualTo("book/a.codex.yaml");
        assertThat(index.getChildren().get(1)).isEqualTo(new IncludeStub("./sub/index.codex.yaml"));

        JsonNode tree = store.toTree(index);
        assertThat(tree.get("children").get(0).has("parent")).isFalse();
        assertThat(tree.get("children").get(0).get("_filename").asText()).isEqualTo("a.codex.yaml");
        assertThat(tree.has("indexType")).isFalse();
    }

    @Test
    void bareCodexExtensionIsSniffed(@TempDir Path dir) throws Exception {
        Path json = dir.resolve("a.codex");
        Files.writeString(json, "{\"id\": \"a\", \"type\": \"note\", \"name\": \"A\"}");
        Path yaml = dir.resolve("b.codex");
        Files.writeString(yaml, "id: b\ntype: note\nname: B\n");

        assertThat(store.formatOf(json)).isEqualTo(CodexFormat.JSON);
        assertThat(store.formatOf(yaml)).isEqualTo(CodexFormat.YAML);
        assertThat(store.readContent(json).getId()).isEqualTo("a");
        assertThat(store.readContent(yaml).getId()).isEqualTo("b");
    }

    @Test
    void codexFileDetection() {
        assertThat(CodexFileStore.isCodexFile(Path.of("x.codex.yaml"))).isTrue();
        assertThat(CodexFileStore.isCodexFile(Path.of("x.CODEX.YML"))).isTrue();
        assertThat(CodexFileStore.isCodexFile(Path.of("x.codex.json"))).isTrue();
        assertThat(CodexFileStore.isCodexFile(Path.of("x.codex"))).isTrue();
        assertThat(CodexFileStore.isCodexFile(Path.of("x.yaml"))).isFalse();
        assertThat(CodexFileStore.isIndexFile("./book/.index.codex.json")).isTrue();
        assertThat(CodexFileStore.isIndexFile("book/index.codex.yml")).isFalse();
    }

    @Test
    void structuralProblemsAreTyped(@TempDir Path dir) {
        assertThatThrownBy(() -> store.readContent(dir.resolve("missing.codex.yaml")))
            .isInstanceOfSatisfying(CodexException.class,
                e -> assertThat(e.getKind()).isEqualTo(CodexErrorKind.FILE_NOT_FOUND));
        assertThatThrownBy(() -> store.parseContent("- just\n- a list\n", CodexFormat.YAML))
            .isInstanceOfSatisfying(CodexException.class,
                e -> assertThat(e.getKind()).isEqualTo(CodexErrorKind.STRUCTURE_ERROR));
        assertThatThrownBy(() -> store.parseContent("children: nope\n", CodexFormat.YAML))
            .isInstanceOfSatisfying(CodexException.class,
                e -> assertThat(e.getKind()).isEqualTo(CodexErrorKind.STRUCTURE_ERROR));
        assertThatThrownBy(() -> store.parseContent("{\"id\": ", CodexFormat.JSON))
            .isInstanceOfSatisfying(CodexException.class,
                e -> assertThat(e.getKind()).isEqualTo(CodexErrorKind.PARSE_ERROR));
    }

    @Test
    void backupIsAByteCopy(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("doc.codex.yaml");
        Files.writeString(file, "id: doc # comment kept\n");

        Path backup = store.backup(file);

        assertThat(backup.getFileName().toString()).isEqualTo("doc.codex.yaml.backup");
        assertThat(Files.readString(backup)).isEqualTo("id: doc # comment kept\n");
    }
}
