package im.arun.codex.config;

import im.arun.codex.io.CodexFormat;
import im.arun.codex.tree.ExplodeOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @Test
    void bundledDefaultsAreLoaded() {
        CodexConfig config = new ConfigLoader().load();

        assertThat(config.getOutputPattern()).isEqualTo("./{type}s/{name}.codex.yaml");
        assertThat(config.getFormat()).isEqualTo("yaml");
        assertThat(config.isBackup()).isTrue();
        assertThat(config.isRecursive()).isTrue();
        assertThat(config.getDefaultStatus()).isEqualTo("private");
        assertThat(config.getMaxIncludeDepth()).isEqualTo(64);
        assertThat(config.isEnforceContainment()).isTrue();
        assertThat(config.getMinOrderGap()).isEqualTo(1e-9);
        assertThat(config.getProjectRoot()).isNull();
    }

    @Test
    void userOptionsAcceptBothKeyStyles() {
        Map<String, Object> options = new HashMap<>();
        options.put("output_pattern", "./out/{id}.codex.json");
        options.put("deleteSourceFiles", "yes");
        options.put("delete_empty_folders", true);
        options.put("max_include_depth", 8);
        options.put("orderStep", 10);
        options.put("enforce_containment", "false");
        options.put("no_such_key", "ignored");

        CodexConfig config = new ConfigLoader().load(options);

        assertThat(config.getOutputPattern()).isEqualTo("./out/{id}.codex.json");
        assertThat(config.isDeleteSourceFiles()).isTrue();
        assertThat(config.isDeleteEmptyFolders()).isTrue();
        assertThat(config.getMaxIncludeDepth()).isEqualTo(8);
        assertThat(config.getOrderStep()).isEqualTo(10.0);
        assertThat(config.isEnforceContainment()).isFalse();
    }

    @Test
    void loadReturnsIndependentCopies() {
        ConfigLoader loader = new ConfigLoader();
        CodexConfig first = loader.load();
        first.setFormat("json");

        assertThat(loader.load().getFormat()).isEqualTo("yaml");
    }

    @Test
    void explicitFileOverridesBundledDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.yaml");
        Files.writeString(file, "format: json\nbackup: false\nprojectRoot: /srv/books\nunknownSetting: 1\n");

        CodexConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getFormat()).isEqualTo("json");
        assertThat(config.isBackup()).isFalse();
        assertThat(config.getProjectRoot()).isEqualTo("/srv/books");
        assertThat(config.getOutputPattern()).isEqualTo("./{type}s/{name}.codex.yaml");
    }

    @Test
    void unsupportedFormatFallsBackToYaml(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.yaml");
        Files.writeString(file, "format: xml\n");

        CodexConfig fromFile = new ConfigLoader(file.toString()).load();
        CodexConfig fromOverride = new ConfigLoader().load(Map.of("format", "toml"));

        assertThat(fromFile.getFormat()).isEqualTo("yaml");
        assertThat(fromOverride.getFormat()).isEqualTo("yaml");
        assertThat(ExplodeOptions.fromConfig(fromFile).getFormat()).isEqualTo(CodexFormat.YAML);
    }

    @Test
    void missingExplicitFileFallsBack(@TempDir Path dir) {
        CodexConfig config = new ConfigLoader(dir.resolve("absent.yaml").toString()).load();

        assertThat(config.getDefaultStatus()).isEqualTo("private");
    }
}
