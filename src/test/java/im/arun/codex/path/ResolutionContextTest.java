package im.arun.codex.path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ResolutionContextTest {

    @Test
    void enterSharesVisitedSet(@TempDir Path dir) {
        ResolutionContext root = ResolutionContext.start(dir, dir, dir.resolve("index.codex.yaml"));
        Path sub = dir.resolve("book/index.codex.yaml");

        ResolutionContext child = root.enter(sub);

        assertThat(child.getBaseDir()).isEqualTo(dir.resolve("book").toAbsolutePath().normalize());
        assertThat(child.getDepth()).isEqualTo(1);
        assertThat(root.isVisited(sub)).isTrue();
        assertThat(root.isVisited(dir.resolve("./index.codex.yaml"))).isTrue();
    }

    @Test
    void branchCopiesVisitedSet(@TempDir Path dir) {
        ResolutionContext root = ResolutionContext.start(dir, dir);
        Path first = dir.resolve("a.codex.yaml");

        ResolutionContext branch = root.branch(first);

        assertThat(branch.isVisited(first)).isTrue();
        assertThat(root.isVisited(first)).isFalse();
        assertThat(branch.markVisited(dir.resolve("b.codex.yaml"))).isTrue();
        assertThat(branch.markVisited(dir.resolve("b.codex.yaml"))).isFalse();
    }
}
