package im.arun.codex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.codex.io.CodexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String RESOURCE_NAME = "codex-config.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final CodexConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private CodexConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled defaults
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), CodexConfig.class);
                }
                logger.warn("Config file {} not found, falling back to bundled defaults", configPath);
            }

            InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(RESOURCE_NAME);
            if (resourceStream != null) {
                try (InputStream in = resourceStream) {
                    return yamlMapper.readValue(in, CodexConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", RESOURCE_NAME);
            return new CodexConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new CodexConfig();
        }
    }

    public CodexConfig load() {
        return load(null);
    }

    public CodexConfig load(Map<String, Object> userOptions) {
        CodexConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return checkFormat(config);
        }

        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "output_pattern":
                    case "outputPattern":
                        if (value instanceof String) config.setOutputPattern((String) value);
                        break;
                    case "format":
                        if (value instanceof String) config.setFormat((String) value);
                        break;
                    case "backup":
                        config.setBackup(parseBoolean(value));
                        break;
                    case "force":
                        config.setForce(parseBoolean(value));
                        break;
                    case "recursive":
                        config.setRecursive(parseBoolean(value));
                        break;
                    case "delete_source_files":
                    case "deleteSourceFiles":
                        config.setDeleteSourceFiles(parseBoolean(value));
                        break;
                    case "delete_empty_folders":
                    case "deleteEmptyFolders":
                        config.setDeleteEmptyFolders(parseBoolean(value));
                        break;
                    case "default_status":
                    case "defaultStatus":
                        if (value instanceof String) config.setDefaultStatus((String) value);
                        break;
                    case "max_include_depth":
                    case "maxIncludeDepth":
                        if (value instanceof Number) config.setMaxIncludeDepth(((Number) value).intValue());
                        break;
                    case "enforce_containment":
                    case "enforceContainment":
                        config.setEnforceContainment(parseBoolean(value));
                        break;
                    case "project_root":
                    case "projectRoot":
                        config.setProjectRoot(value == null ? null : value.toString());
                        break;
                    case "min_order_gap":
                    case "minOrderGap":
                        if (value instanceof Number) config.setMinOrderGap(((Number) value).doubleValue());
                        break;
                    case "order_step":
                    case "orderStep":
                        if (value instanceof Number) config.setOrderStep(((Number) value).doubleValue());
                        break;
                    case "journal_dir":
                    case "journalDir":
                        config.setJournalDir(value == null ? null : value.toString());
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return checkFormat(config);
    }

    private CodexConfig checkFormat(CodexConfig config) {
        try {
            CodexFormat.parse(config.getFormat());
        } catch (IllegalArgumentException e) {
            logger.warn("Unsupported format '{}', using yaml", config.getFormat());
            config.setFormat("yaml");
        }
        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private CodexConfig copyConfig(CodexConfig source) {
        CodexConfig copy = new CodexConfig();
        copy.setOutputPattern(source.getOutputPattern());
        copy.setFormat(source.getFormat());
        copy.setBackup(source.isBackup());
        copy.setForce(source.isForce());
        copy.setRecursive(source.isRecursive());
        copy.setDeleteSourceFiles(source.isDeleteSourceFiles());
        copy.setDeleteEmptyFolders(source.isDeleteEmptyFolders());
        copy.setDefaultStatus(source.getDefaultStatus());
        copy.setMaxIncludeDepth(source.getMaxIncludeDepth());
        copy.setEnforceContainment(source.isEnforceContainment());
        copy.setProjectRoot(source.getProjectRoot());
        copy.setMinOrderGap(source.getMinOrderGap());
        copy.setOrderStep(source.getOrderStep());
        copy.setJournalDir(source.getJournalDir());
        return copy;
    }
}
