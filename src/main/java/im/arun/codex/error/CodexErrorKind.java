package im.arun.codex.error;

/**
 * Failure taxonomy. Structural kinds abort an operation when they hit the root
 * document; the rest are recorded per item.
 */
public enum CodexErrorKind {
    FILE_NOT_FOUND(true),
    PARSE_ERROR(true),
    STRUCTURE_ERROR(true),
    OUTPUT_EXISTS(false),
    CIRCULAR_REFERENCE(false),
    UNRESOLVED_INCLUDE(false),
    PATH_ESCAPE(false),
    IO_ERROR(false),
    NODE_NOT_FOUND(false),
    INVALID_MOVE(false),
    PARTIAL_BATCH_FAILURE(false);

    private final boolean structural;

    CodexErrorKind(boolean structural) {
        this.structural = structural;
    }

    public boolean isStructural() {
        return structural;
    }
}
