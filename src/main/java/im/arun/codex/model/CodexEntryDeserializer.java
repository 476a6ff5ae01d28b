package im.arun.codex.model;

public class CodexEntryDeserializer extends StubAwareDeserializer<CodexEntry, ContentNode> {

    public CodexEntryDeserializer() {
        super(CodexEntry.class, ContentNode.class);
    }

    @Override
    protected CodexEntry fromStub(IncludeStub stub) {
        return stub;
    }
}
