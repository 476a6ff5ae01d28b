package im.arun.codex.config;

import lombok.Data;

/**
 * Engine configuration. One instance is built per caller and passed explicitly to
 * every component.
 */
@Data
public class CodexConfig {
    // explode
    private String outputPattern = "./{type}s/{name}.codex.yaml";
    private String format = "yaml";
    private boolean backup = true;
    private boolean force = false;

    // implode
    private boolean recursive = true;
    private boolean deleteSourceFiles = false;
    private boolean deleteEmptyFolders = false;

    // index resolution
    private String defaultStatus = "private";
    private int maxIncludeDepth = 64;

    // path safety
    private boolean enforceContainment = true;
    private String projectRoot;

    // ordering
    private double minOrderGap = 1e-9;
    private double orderStep = 1.0;

    private String journalDir;
}
