package org.dxworks.sasframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class SasframeConfigTest {

    @Test
    void load_ReadsYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sasframe-config.yml");
        Files.writeString(file, "maxFileLines: 500\nfileTimeoutSeconds: 5\nparallelism: 3\n"
                + "registryFile: rules/custom.yml\n");

        SasframeConfig config = SasframeConfig.load(file);

        assertEquals(500, config.getMaxFileLines());
        assertEquals(5, config.getFileTimeoutSeconds());
        assertEquals(3, config.getParallelism());
        assertEquals("rules/custom.yml", config.getRegistryFile());
    }

    @Test
    void load_MissingValuesUseDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sasframe-config.yml");
        Files.writeString(file, "fileTimeoutSeconds: 10\nparallelism: -2\n");

        SasframeConfig config = SasframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(10, config.getFileTimeoutSeconds());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.getParallelism());
        assertNull(config.getRegistryFile());
    }

    @Test
    void load_MissingFile(@TempDir Path dir) {
        SasframeConfig config = SasframeConfig.load(dir.resolve("absent.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals(60, config.getFileTimeoutSeconds());
    }

    @Test
    void load_UnknownPropertyFallsBackToDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sasframe-config.yml");
        Files.writeString(file, "maxFileLines: 10\nthreads: 4\n");

        SasframeConfig config = SasframeConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void with_BlankRegistryIsBundled() {
        assertNull(SasframeConfig.with(1, 1, 1, "  ").getRegistryFile());
    }
}
