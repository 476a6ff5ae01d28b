package im.arun.codex.error;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One failed item of a best-effort batch.
 */
@Data
@AllArgsConstructor
public class ItemFailure {
    private final String item;
    private final CodexErrorKind kind;
    private final String message;

    public static ItemFailure of(String item, CodexException e) {
        return new ItemFailure(item, e.getKind(), e.getMessage());
    }

    @Override
    public String toString() {
        return message;
    }
}
