package im.arun.codex.index;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.codex.io.CodexFileStore;
import im.arun.codex.model.IndexDocument;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TypeStyleApplierTest {

    private static final String INDEX = """
        type: index
        typeStyles:
          - type: chapter
            emoji: "📖"
            color: "#3366ff"
          - type: scene
            color: gray
        children:
          - id: a
            type: chapter
            name: A
            color: red
            children:
              - id: s
                type: scene
                name: S
                status: published
          - id: b
            type: character
            name: B
            _default_status: public
        """;

    @Test
    void stylingTwiceEqualsStylingOnce() {
        CodexFileStore store = new CodexFileStore();
        IndexDocument once = store.parseIndex(INDEX);
        IndexDocument twice = store.parseIndex(INDEX);

        TypeStyleApplier.applyTypeStyles(once.getChildren(), once.getTypeStyles());
        TypeStyleApplier.applyDefaultStatus(once.getChildren(), "private");

        TypeStyleApplier.applyTypeStyles(twice.getChildren(), twice.getTypeStyles());
        TypeStyleApplier.applyDefaultStatus(twice.getChildren(), "private");
        TypeStyleApplier.applyTypeStyles(twice.getChildren(), twice.getTypeStyles());
        TypeStyleApplier.applyDefaultStatus(twice.getChildren(), "private");

        JsonNode expected = store.toTree(once);
        assertThat(store.toTree(twice)).isEqualTo(expected);

        JsonNode a = expected.get("children").get(0);
        assertThat(a.get("_type_emoji").asText()).isEqualTo("📖");
        assertThat(a.has("_type_color")).isFalse();
        assertThat(a.get("color").asText()).isEqualTo("red");
        assertThat(a.get("children").get(0).get("_type_color").asText()).isEqualTo("gray");
        assertThat(a.get("children").get(0).get("_default_status").asText()).isEqualTo("private");
        assertThat(expected.get("children").get(1).get("_default_status").asText()).isEqualTo("public");
    }

    @Test
    void missingStylesLeaveTreeUntouched() {
        CodexFileStore store = new CodexFileStore();
        IndexDocument document = store.parseIndex("type: index\nchildren:\n  - {id: a, type: chapter, name: A}\n");
        JsonNode before = store.toTree(document);

        TypeStyleApplier.applyTypeStyles(document.getChildren(), null);

        assertThat(store.toTree(document)).isEqualTo(before);
    }
}
