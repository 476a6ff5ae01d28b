package im.arun.codex.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * An element of an index document's {@code children} sequence.
 * Either an {@link IncludeStub} (sub-index or leaf file) or an {@link IndexNode}.
 */
@JsonDeserialize(using = IndexEntryDeserializer.class)
public interface IndexEntry {
}
