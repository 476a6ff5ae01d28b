package im.arun.codex.tree;

import im.arun.codex.error.CodexException;
import im.arun.codex.error.ItemFailure;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an implode call. Unresolved stubs are reported in {@code errors} and
 * stay in the document; {@code success} is false only for structural failures.
 */
@Data
@NoArgsConstructor
public class ImplodeResult {
    private boolean success;
    private boolean dryRun;
    private int mergedCount;
    private List<String> mergedFiles = new ArrayList<>();
    private List<String> deletedFiles = new ArrayList<>();
    private List<String> deletedFolders = new ArrayList<>();
    private List<ItemFailure> failures = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    private String backupFile;

    public static ImplodeResult failure(CodexException e) {
        ImplodeResult result = new ImplodeResult();
        result.setSuccess(false);
        result.getFailures().add(ItemFailure.of("document", e));
        result.getErrors().add(e.getMessage());
        return result;
    }

    public static ImplodeResult nothingToDo(String reason, boolean dryRun) {
        ImplodeResult result = new ImplodeResult();
        result.setSuccess(true);
        result.setDryRun(dryRun);
        result.getErrors().add(reason);
        return result;
    }
}
