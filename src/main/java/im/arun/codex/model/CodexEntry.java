package im.arun.codex.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * An element of a content document's {@code children} sequence.
 * Either an {@link IncludeStub} pointing at another file or an inline {@link ContentNode}.
 * The variant is decided once, when the document is parsed.
 */
@JsonDeserialize(using = CodexEntryDeserializer.class)
public interface CodexEntry {
}
