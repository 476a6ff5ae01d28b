package im.arun.codex.util;

import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.error.ItemFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.function.Function;

/**
 * Sequential best-effort fold over a batch. A failing item is recorded and the next
 * one is processed; cancellation is honoured between items only.
 */
public final class BatchProcessor {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private BatchProcessor() {}

    /**
     * Work for a single item. May throw {@link CodexException} or {@link IOException};
     * both are captured as item failures.
     */
    @FunctionalInterface
    public interface ItemHandler<T, R> {
        R handle(T item, int position) throws IOException;
    }

    public static <T, R> BatchOutcome<T, R> fold(
            List<T> items,
            Function<T, String> label,
            ItemHandler<T, R> handler,
            ProgressListener progress,
            CancellationToken cancellation) {

        BatchOutcome<T, R> outcome = new BatchOutcome<>();
        ProgressListener listener = progress != null ? progress : ProgressListener.NONE;
        int total = items.size();

        for (int i = 0; i < total; i++) {
            if (cancellation != null && cancellation.isCancelled()) {
                logger.info("Batch cancelled after {} of {} items", i, total);
                outcome.markCancelled(total - i);
                break;
            }

            T item = items.get(i);
            String itemLabel = label.apply(item);
            try {
                R value = handler.handle(item, i);
                outcome.addSuccess(i, item, value);
            } catch (CodexException e) {
                logger.warn("Item '{}' failed: {}", itemLabel, e.getMessage());
                outcome.addFailure(i, item, ItemFailure.of(itemLabel, e));
            } catch (IOException | RuntimeException e) {
                logger.warn("Item '{}' failed: {}", itemLabel, e.toString());
                outcome.addFailure(i, item, new ItemFailure(itemLabel, CodexErrorKind.IO_ERROR,
                    String.format("Failed to process %s: %s", itemLabel, e.getMessage())));
            }
            listener.onProgress(i + 1, total, itemLabel);
        }

        return outcome;
    }
}
