package org.dxworks.sasframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.sasframe.error.RegistryLoadException;
import org.dxworks.sasframe.rules.Registries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AppTest {

    @Test
    void main_WritesJsonLinesReport(@TempDir Path dir) throws Exception {
        Path input = Files.createDirectories(dir.resolve("programs"));
        Files.writeString(input.resolve("good.sas"), "data a;\n  set b;\nrun;\n");
        Files.writeString(input.resolve("broken.sas"), "data a;\n  msg = 'never closed;\nrun;\n");
        Files.writeString(input.resolve("notes.txt"), "not a program\n");
        Path output = dir.resolve("out").resolve("report.jsonl");

        App.main(new String[]{input.toString(), output.toString()});

        ObjectMapper mapper = new ObjectMapper();
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals(4, lines.size());

        JsonNode run = mapper.readTree(lines.get(0));
        assertEquals("run", run.get("kind").asText());
        assertEquals(2, run.get("total_files").asInt());

        Set<String> statuses = new HashSet<>();
        for (String line : lines.subList(1, 3)) {
            JsonNode report = mapper.readTree(line);
            assertEquals("analysis", report.get("kind").asText());
            statuses.add(report.get("file").get("fileName").asText() + ":" + report.get("status").asText());
        }
        assertEquals(Set.of("good.sas:complete", "broken.sas:failed"), statuses);

        JsonNode done = mapper.readTree(lines.get(3));
        assertEquals("done", done.get("kind").asText());
        assertEquals(1, done.get("files_complete").asInt());
        assertEquals(0, done.get("files_partial").asInt());
        assertEquals(1, done.get("files_failed").asInt());
    }

    @Test
    void loadRegistries_BundledByDefault() {
        Registries registries = App.loadRegistries(SasframeConfig.defaults());

        assertFalse(registries.getRiskRules().getRules().isEmpty());
        assertFalse(registries.getMappingRules().getRules().isEmpty());
    }

    @Test
    void loadRegistries_MissingCustomRegistryIsRejected(@TempDir Path dir) {
        SasframeConfig config = SasframeConfig.with(0, 0, 0, dir.resolve("absent.yml").toString());

        assertThrows(RegistryLoadException.class, () -> App.loadRegistries(config));
    }
}
