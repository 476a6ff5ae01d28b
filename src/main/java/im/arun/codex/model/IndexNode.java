package im.arun.codex.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AccessLevel;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Navigation node of an index document.
 * <p>
 * Underscore-prefixed fields are computed by the resolver and never override the
 * explicit {@code emoji}/{@code color}. {@code parent} is a runtime back-reference
 * and is not serialized.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "type", "name", "title", "order", "expanded", "emoji", "color", "status",
    "attributes", "_filename", "_computed_path", "_format", "_type_emoji", "_type_color",
    "_default_status", "_included_from", "_subindex_path", "children"})
@JsonDeserialize(using = JsonDeserializer.None.class)
public class IndexNode implements IndexEntry {

    private String id;
    private String type;
    private String name;
    private String title;
    private Double order;
    private Boolean expanded;
    private String emoji;
    private String color;
    private String status;
    private List<Attribute> attributes;
    private List<IndexEntry> children;

    @JsonProperty("_filename")
    private String filename;

    @JsonProperty("_computed_path")
    private String computedPath;

    @JsonProperty("_format")
    private String format;

    @JsonProperty("_type_emoji")
    private String typeEmoji;

    @JsonProperty("_type_color")
    private String typeColor;

    @JsonProperty("_default_status")
    private String defaultStatus;

    @JsonProperty("_included_from")
    private String includedFrom;

    @JsonProperty("_subindex_path")
    private String subIndexPath;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private IndexNode parent;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, JsonNode> extras = new LinkedHashMap<>();

    public IndexNode(String id, String type, String name) {
        this.id = id;
        this.type = type;
        this.name = name;
    }

    @JsonAnySetter
    public void putExtra(String key, JsonNode value) {
        extras.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extras() {
        return extras;
    }

    /**
     * Order value used for sorting; absent orders count as 0.
     */
    public double orderOrZero() {
        return order == null ? 0.0 : order;
    }

    public List<IndexNode> childNodes() {
        List<IndexNode> nodes = new ArrayList<>();
        if (children != null) {
            for (IndexEntry child : children) {
                if (child instanceof IndexNode) {
                    nodes.add((IndexNode) child);
                }
            }
        }
        return nodes;
    }

    /**
     * Emoji shown for this node: an {@code emoji} attribute, then the explicit field,
     * then the type style.
     */
    public String effectiveEmoji() {
        String fromAttribute = attributeValue("emoji");
        if (fromAttribute != null) {
            return fromAttribute;
        }
        return emoji != null ? emoji : typeEmoji;
    }

    public String effectiveColor() {
        String fromAttribute = attributeValue("color");
        if (fromAttribute != null) {
            return fromAttribute;
        }
        return color != null ? color : typeColor;
    }

    private String attributeValue(String key) {
        if (attributes == null) {
            return null;
        }
        for (Attribute attribute : attributes) {
            if (key.equals(attribute.getKey()) && attribute.getValue() != null) {
                return String.valueOf(attribute.getValue());
            }
        }
        return null;
    }
}
