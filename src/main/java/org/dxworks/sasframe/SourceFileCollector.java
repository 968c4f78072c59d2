package org.dxworks.sasframe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Finds the {@code .sas} files under an input path, skipping files longer than the configured limit.
 */
public class SourceFileCollector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceFileCollector.class);
    private static final String EXTENSION = ".sas";

    private final int maxFileLines;

    public SourceFileCollector(int maxFileLines) {
        this.maxFileLines = maxFileLines;
    }

    public List<Path> collect(Path input) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(SourceFileCollector::isSasFile)
                      .filter(this::withinMaxLines)
                      .sorted()
                      .forEach(files::add);
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
        } else if (Files.isRegularFile(input) && isSasFile(input) && withinMaxLines(input)) {
            files.add(input);
        }
        return files;
    }

    static boolean isSasFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    private boolean withinMaxLines(Path path) {
        // ISO-8859-1 never fails to decode, so Latin-1 sources are counted too
        try (Stream<String> lines = Files.lines(path, StandardCharsets.ISO_8859_1)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                LOGGER.info("Skipping {}: more than {} lines", path, maxFileLines);
                return false;
            }
            return true;
        } catch (IOException e) {
            LOGGER.warn("Cannot count lines of {}, analysing it anyway: {}", path, e.getMessage());
            return true;
        }
    }
}
