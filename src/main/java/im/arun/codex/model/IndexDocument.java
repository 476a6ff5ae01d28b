package im.arun.codex.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A per-folder index file ({@code type: index}): navigation metadata for a folder's
 * contents, with optional type styles and include/exclude patterns.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"metadata", "id", "type", "name", "title", "summary", "emoji", "status",
    "attributes", "patterns", "typeStyles", "children"})
public class IndexDocument {

    public static final String INDEX_TYPE = "index";

    private ObjectNode metadata;
    private String id;
    private String type;
    private String name;
    private String title;
    private String summary;
    private String emoji;
    private String status;
    private List<Attribute> attributes;
    private IndexPatterns patterns;
    private List<TypeStyle> typeStyles;
    private List<IndexEntry> children;

    @JsonProperty("scrivener_label")
    private String scrivenerLabel;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, JsonNode> extras = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, JsonNode value) {
        extras.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extras() {
        return extras;
    }

    @JsonIgnore
    public boolean isIndexType() {
        return INDEX_TYPE.equals(type);
    }

    /**
     * Number of non-folder nodes in the tree.
     */
    public int countFiles() {
        return countFiles(children);
    }

    private static int countFiles(List<IndexEntry> entries) {
        int count = 0;
        if (entries == null) {
            return count;
        }
        for (IndexEntry entry : entries) {
            if (entry instanceof IndexNode) {
                IndexNode node = (IndexNode) entry;
                if (!"folder".equals(node.getType())) {
                    count++;
                }
                count += countFiles(node.getChildren());
            }
        }
        return count;
    }
}
