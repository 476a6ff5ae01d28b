package im.arun.codex.index;

import im.arun.codex.error.CodexException;
import im.arun.codex.error.ItemFailure;
import im.arun.codex.model.IndexDocument;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A resolved index tree plus the warnings raised while composing it. Circular,
 * missing and escaping sub-indexes show up here; they never fail the resolution.
 */
@Data
@NoArgsConstructor
public class IndexResolution {
    private boolean success;
    private IndexDocument document;
    private int subIndexCount;
    private int leafIncludeCount;
    private List<ItemFailure> failures = new ArrayList<>();
    private List<String> errors = new ArrayList<>();

    public static IndexResolution failure(CodexException e) {
        IndexResolution resolution = new IndexResolution();
        resolution.setSuccess(false);
        resolution.getFailures().add(ItemFailure.of("index", e));
        resolution.getErrors().add(e.getMessage());
        return resolution;
    }

    void warn(String item, CodexException e) {
        failures.add(ItemFailure.of(item, e));
        errors.add(e.getMessage());
    }
}
