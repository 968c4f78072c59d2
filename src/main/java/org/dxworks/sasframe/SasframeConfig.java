package org.dxworks.sasframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class SasframeConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(SasframeConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_FILE_TIMEOUT_SECONDS = 60;
    private static final String CONFIG_FILE_NAME = "sasframe-config.yml";

    private final int maxFileLines;
    private final int fileTimeoutSeconds;
    private final int parallelism;
    private final String registryFile;

    private SasframeConfig(int maxFileLines, int fileTimeoutSeconds, int parallelism, String registryFile) {
        this.maxFileLines = maxFileLines;
        this.fileTimeoutSeconds = fileTimeoutSeconds;
        this.parallelism = parallelism;
        this.registryFile = registryFile;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getFileTimeoutSeconds() {
        return fileTimeoutSeconds;
    }

    public int getParallelism() {
        return parallelism;
    }

    /** Custom registry replacing the bundled one, or null. */
    public String getRegistryFile() {
        return registryFile;
    }

    public static SasframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    static SasframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.maxFileLines != null ? yamlConfig.maxFileLines : 0,
                        yamlConfig.fileTimeoutSeconds != null ? yamlConfig.fileTimeoutSeconds : 0,
                        yamlConfig.parallelism != null ? yamlConfig.parallelism : 0,
                        yamlConfig.registryFile);
            }
        } catch (IOException e) {
            LOGGER.warn("Ignoring unreadable {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static SasframeConfig defaults() {
        return with(0, 0, 0, null);
    }

    /** Non-positive values fall back to the defaults. */
    public static SasframeConfig with(int maxFileLines, int fileTimeoutSeconds, int parallelism, String registryFile) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        int effectiveTimeout = fileTimeoutSeconds > 0 ? fileTimeoutSeconds : DEFAULT_FILE_TIMEOUT_SECONDS;
        int effectiveParallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        String effectiveRegistry = registryFile != null && !registryFile.isBlank() ? registryFile : null;
        return new SasframeConfig(effectiveMaxFileLines, effectiveTimeout, effectiveParallelism, effectiveRegistry);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer fileTimeoutSeconds;
        public Integer parallelism;
        public String registryFile;
    }
}
