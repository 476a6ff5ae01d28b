package im.arun.codex.tree;

import im.arun.codex.error.CodexException;
import im.arun.codex.error.ItemFailure;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of an explode call. {@code success} is false only for structural failures
 * of the source document; per-child problems are listed in {@code errors}.
 */
@Data
@NoArgsConstructor
public class ExplodeResult {
    private boolean success;
    private boolean dryRun;
    private int extractedCount;
    private List<String> extractedFiles = new ArrayList<>();
    private Map<String, String> extractionMap = new LinkedHashMap<>();
    private List<ItemFailure> failures = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    private String backupFile;

    public static ExplodeResult failure(CodexException e) {
        ExplodeResult result = new ExplodeResult();
        result.setSuccess(false);
        result.getFailures().add(ItemFailure.of("document", e));
        result.getErrors().add(e.getMessage());
        return result;
    }

    public static ExplodeResult nothingToDo(String reason, boolean dryRun) {
        ExplodeResult result = new ExplodeResult();
        result.setSuccess(true);
        result.setDryRun(dryRun);
        result.getErrors().add(reason);
        return result;
    }
}
