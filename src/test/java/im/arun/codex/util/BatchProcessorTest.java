package im.arun.codex.util;

import im.arun.codex.error.CodexErrorKind;
import im.arun.codex.error.CodexException;
import im.arun.codex.error.ItemFailure;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchProcessorTest {

    @Test
    void failuresDoNotStopTheBatch() {
        List<String> progress = new ArrayList<>();

        BatchOutcome<String, Integer> outcome = BatchProcessor.fold(
            List.of("one", "boom", "three", "io"),
            item -> item,
            (item, position) -> {
                if (item.equals("boom")) {
                    throw new CodexException(CodexErrorKind.OUTPUT_EXISTS, "File already exists: boom");
                }
                if (item.equals("io")) {
                    throw new IOException("disk full");
                }
                return item.length();
            },
            (done, total, message) -> progress.add(done + "/" + total + " " + message),
            CancellationToken.none());

        assertThat(outcome.getSuccesses()).extracting(success -> success.value).containsExactly(3, 5);
        assertThat(outcome.getSuccesses()).extracting(success -> success.position).containsExactly(0, 2);
        assertThat(outcome.itemFailures()).extracting(ItemFailure::getKind)
            .containsExactly(CodexErrorKind.OUTPUT_EXISTS, CodexErrorKind.IO_ERROR);
        assertThat(outcome.failureMessages()).containsExactly(
            "File already exists: boom", "Failed to process io: disk full");
        assertThat(outcome.summary()).isEqualTo("2 succeeded, 2 failed");
        assertThat(progress).containsExactly("1/4 one", "2/4 boom", "3/4 three", "4/4 io");
    }

    @Test
    void cancellationIsHonouredBetweenItems() {
        CancellationToken token = new CancellationToken();
        List<String> handled = new ArrayList<>();

        BatchOutcome<String, String> outcome = BatchProcessor.fold(
            List.of("a", "b", "c"),
            item -> item,
            (item, position) -> {
                handled.add(item);
                if (position == 1) {
                    token.cancel();
                }
                return item;
            },
            ProgressListener.NONE,
            token);

        assertThat(handled).containsExactly("a", "b");
        assertThat(outcome.isCancelled()).isTrue();
        assertThat(outcome.getSkipped()).isEqualTo(1);
        assertThat(outcome.summary()).isEqualTo("2 succeeded, 0 failed, 1 skipped (cancelled)");
    }
}
