package im.arun.codex.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@code {key, value}} attribute pair on a codex node.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attribute {

    @JsonProperty("key")
    private String key;

    @JsonProperty("value")
    private Object value;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private Map<String, JsonNode> extras = new LinkedHashMap<>();

    public Attribute(String key, Object value) {
        this.key = key;
        this.value = value;
    }

    @JsonAnySetter
    public void putExtra(String name, JsonNode value) {
        extras.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> extras() {
        return extras;
    }
}
