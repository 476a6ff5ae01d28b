package im.arun.codex.order;

import im.arun.codex.config.CodexConfig;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call options of {@link IndexReorderer}.
 */
@Data
@NoArgsConstructor
public class ReorderOptions {
    private boolean dryRun = false;
    private boolean backup = true;

    public static ReorderOptions fromConfig(CodexConfig config) {
        ReorderOptions options = new ReorderOptions();
        options.setBackup(config.isBackup());
        return options;
    }
}
