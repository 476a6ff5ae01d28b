package im.arun.codex.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Splits a children element into a stub or a full node by looking at its shape once.
 *
 * @param <T> the entry union being deserialized
 * @param <N> the concrete node type for non-stub objects
 */
public abstract class StubAwareDeserializer<T, N extends T> extends StdDeserializer<T> {

    private final Class<N> nodeType;

    protected StubAwareDeserializer(Class<T> entryType, Class<N> nodeType) {
        super(entryType);
        this.nodeType = nodeType;
    }

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode tree = ctxt.readTree(p);

        if (IncludeStub.isStub(tree)) {
            return fromStub(new IncludeStub(tree.get(IncludeStub.INCLUDE_KEY).asText()));
        }
        if (!tree.isObject()) {
            return ctxt.reportInputMismatch(this,
                "Expected an object in 'children' but found %s", tree.getNodeType());
        }
        return ctxt.readTreeAsValue(tree, nodeType);
    }

    protected abstract T fromStub(IncludeStub stub);
}
