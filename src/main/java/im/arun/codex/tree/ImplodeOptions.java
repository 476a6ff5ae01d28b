package im.arun.codex.tree;

import im.arun.codex.config.CodexConfig;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ImplodeOptions {
    private boolean dryRun;
    private boolean deleteSourceFiles;
    private boolean backup = true;
    private boolean recursive = true;
    private boolean deleteEmptyFolders;

    public static ImplodeOptions fromConfig(CodexConfig config) {
        ImplodeOptions options = new ImplodeOptions();
        options.setBackup(config.isBackup());
        options.setRecursive(config.isRecursive());
        options.setDeleteSourceFiles(config.isDeleteSourceFiles());
        options.setDeleteEmptyFolders(config.isDeleteEmptyFolders());
        return options;
    }
}
