package im.arun.codex.order;

import im.arun.codex.error.CodexException;
import im.arun.codex.error.ItemFailure;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a drag-and-drop reorder: the new order of every moved item and the
 * items that could not be moved.
 */
@Data
@NoArgsConstructor
public class ReorderResult {
    private boolean success;
    private boolean dryRun;
    private int movedCount;
    private Map<String, Double> newOrders = new LinkedHashMap<>();
    private boolean renumbered;
    private List<ItemFailure> failures = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    private String backupFile;

    public static ReorderResult failure(CodexException e) {
        ReorderResult result = new ReorderResult();
        result.setSuccess(false);
        result.getFailures().add(ItemFailure.of("index", e));
        result.getErrors().add(e.getMessage());
        return result;
    }
}
