package im.arun.codex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference-only child entry: {@code { include: "<path>" }}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonDeserialize(using = JsonDeserializer.None.class)
public class IncludeStub implements CodexEntry, IndexEntry {

    public static final String INCLUDE_KEY = "include";

    @JsonProperty(INCLUDE_KEY)
    private String include;

    /**
     * Structural predicate: an object whose only key is a string-valued {@code include}.
     */
    public static boolean isStub(JsonNode node) {
        return node != null
            && node.isObject()
            && node.size() == 1
            && node.has(INCLUDE_KEY)
            && node.get(INCLUDE_KEY).isTextual();
    }
}
