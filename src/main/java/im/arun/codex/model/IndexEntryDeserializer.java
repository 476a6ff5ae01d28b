package im.arun.codex.model;

public class IndexEntryDeserializer extends StubAwareDeserializer<IndexEntry, IndexNode> {

    public IndexEntryDeserializer() {
        super(IndexEntry.class, IndexNode.class);
    }

    @Override
    protected IndexEntry fromStub(IncludeStub stub) {
        return stub;
    }
}
