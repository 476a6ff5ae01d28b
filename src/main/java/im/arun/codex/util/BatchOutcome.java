package im.arun.codex.util;

import im.arun.codex.error.ItemFailure;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of folding a batch: what succeeded, what failed, and whether the fold was
 * cancelled before reaching the end.
 *
 * @param <T> input item type
 * @param <R> per-item success value
 */
@Getter
public class BatchOutcome<T, R> {

    /**
     * A successful item together with its input position.
     */
    public static class Success<T, R> {
        public final int position;
        public final T item;
        public final R value;

        public Success(int position, T item, R value) {
            this.position = position;
            this.item = item;
            this.value = value;
        }
    }

    /**
     * A failed item together with its input position.
     */
    public static class Failure<T> {
        public final int position;
        public final T item;
        public final ItemFailure failure;

        public Failure(int position, T item, ItemFailure failure) {
            this.position = position;
            this.item = item;
            this.failure = failure;
        }
    }

    private final List<Success<T, R>> successes = new ArrayList<>();
    private final List<Failure<T>> failures = new ArrayList<>();
    private boolean cancelled;
    private int skipped;

    void addSuccess(int position, T item, R value) {
        successes.add(new Success<>(position, item, value));
    }

    void addFailure(int position, T item, ItemFailure failure) {
        failures.add(new Failure<>(position, item, failure));
    }

    void markCancelled(int remaining) {
        this.cancelled = true;
        this.skipped = remaining;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public List<ItemFailure> itemFailures() {
        List<ItemFailure> result = new ArrayList<>();
        for (Failure<T> failure : failures) {
            result.add(failure.failure);
        }
        return Collections.unmodifiableList(result);
    }

    public List<String> failureMessages() {
        List<String> result = new ArrayList<>();
        for (Failure<T> failure : failures) {
            result.add(failure.failure.getMessage());
        }
        return result;
    }

    /**
     * Aggregate line, e.g. {@code "2 succeeded, 1 failed"}.
     */
    public String summary() {
        String text = String.format("%d succeeded, %d failed", successes.size(), failures.size());
        if (cancelled) {
            text += String.format(", %d skipped (cancelled)", skipped);
        }
        return text;
    }
}
