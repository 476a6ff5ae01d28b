package im.arun.codex.util;

/**
 * Receives item-boundary progress from batch operations.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (done, total, message) -> { };

    void onProgress(int done, int total, String message);
}
