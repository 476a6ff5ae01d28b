package im.arun.codex.tree;

import im.arun.codex.config.CodexConfig;
import im.arun.codex.io.CodexFormat;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Options for one explode call. An empty or absent {@code types} list extracts every
 * direct child.
 */
@Data
@NoArgsConstructor
public class ExplodeOptions {
    private List<String> types = new ArrayList<>();
    private String outputPattern = "./{type}s/{name}.codex.yaml";
    private CodexFormat format = CodexFormat.YAML;
    private boolean dryRun;
    private boolean backup = true;
    private boolean force;

    public static ExplodeOptions fromConfig(CodexConfig config) {
        ExplodeOptions options = new ExplodeOptions();
        options.setOutputPattern(config.getOutputPattern());
        options.setFormat(CodexFormat.parse(config.getFormat()));
        options.setBackup(config.isBackup());
        options.setForce(config.isForce());
        return options;
    }

    public boolean extractsAll() {
        return types == null || types.isEmpty();
    }
}
