package im.arun.codex.error;

/**
 * Raised by the file store and path resolver; operations catch it at their boundary
 * and turn it into a failed result or a per-item failure.
 */
public class CodexException extends RuntimeException {

    private final CodexErrorKind kind;

    public CodexException(CodexErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CodexException(CodexErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CodexErrorKind getKind() {
        return kind;
    }
}
