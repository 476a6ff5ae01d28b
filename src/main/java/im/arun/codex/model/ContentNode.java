package im.arun.codex.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a content document. The root document itself is a ContentNode that
 * carries a {@code metadata} block.
 * <p>
 * Fields the engine does not know about are kept in {@link #extras()} so that a
 * node survives a read/write cycle unchanged.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"metadata", "id", "type", "name", "title", "body", "attributes", "children"})
@JsonDeserialize(using = JsonDeserializer.None.class)
public class ContentNode implements CodexEntry {

    @JsonProperty("metadata")
    private ObjectNode metadata;

    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("name")
    private String name;

    @JsonProperty("title")
    private String title;

    @JsonProperty("body")
    private String body;

    @JsonProperty("attributes")
    private List<Attribute> attributes;

    @JsonProperty("children")
    private List<CodexEntry> children;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, JsonNode> extras = new LinkedHashMap<>();

    public ContentNode(String id, String type, String name) {
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

    public boolean hasChildren() {
        return children != null;
    }

    /**
     * Display label: name, then title, then the given fallback.
     */
    public String displayName(String fallback) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (title != null && !title.isBlank()) {
            return title;
        }
        return fallback;
    }

    public ContentNode addChild(CodexEntry child) {
        if (children == null) {
            children = new ArrayList<>();
        }
        children.add(child);
        return this;
    }

    /**
     * Copy of this node without its {@code metadata} block. Children and extras are
     * copied shallowly (the list is new, the entries are shared).
     */
    public ContentNode withoutMetadata() {
        ContentNode copy = new ContentNode();
        copy.id = id;
        copy.type = type;
        copy.name = name;
        copy.title = title;
        copy.body = body;
        copy.attributes = attributes == null ? null : new ArrayList<>(attributes);
        copy.children = children == null ? null : new ArrayList<>(children);
        copy.extras.putAll(extras);
        return copy;
    }
}
