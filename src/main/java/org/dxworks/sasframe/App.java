package org.dxworks.sasframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.sasframe.error.RegistryLoadException;
import org.dxworks.sasframe.report.AnalysisReport;
import org.dxworks.sasframe.report.ReportStatus;
import org.dxworks.sasframe.rules.Registries;
import org.dxworks.sasframe.rules.RegistryLoader;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar sasframe.jar <input-path> <output-file>");
            System.err.println("  <input-path>:  SAS program or directory containing .sas files");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        SasframeConfig config = SasframeConfig.load();
        Registries registries;
        try {
            registries = loadRegistries(config);
        } catch (RegistryLoadException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println("Starting SAS analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = new SourceFileCollector(config.getMaxFileLines()).collect(input);
        System.out.println("Found " + files.size() + " SAS files");

        Instant startTime = Instant.now();
        AtomicInteger completeCount = new AtomicInteger(0);
        AtomicInteger partialCount = new AtomicInteger(0);
        AtomicInteger failedCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8);
             BatchAnalyzer batch = new BatchAnalyzer(new SasAnalyzer(registries), config.getParallelism(),
                     Duration.ofSeconds(config.getFileTimeoutSeconds()))) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            batch.analyzeAll(files, report -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] " + report.status.id() + ": "
                            + report.file.fileName);
                }
                countStatus(report, completeCount, partialCount, failedCount);
                try {
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(report));
                        writer.newLine();
                        writer.flush();
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to write report for " + report.file.path, e);
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_complete", completeCount.get());
            doneInfo.put("files_partial", partialCount.get());
            doneInfo.put("files_failed", failedCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Complete: " + completeCount.get() + ", partial: " + partialCount.get()
                + ", failed: " + failedCount.get());
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static Registries loadRegistries(SasframeConfig config) {
        RegistryLoader loader = new RegistryLoader();
        if (config.getRegistryFile() != null) {
            return loader.load(Paths.get(config.getRegistryFile()));
        }
        return loader.loadDefault();
    }

    private static void countStatus(AnalysisReport report, AtomicInteger complete, AtomicInteger partial,
                                    AtomicInteger failed) {
        if (report.status == ReportStatus.COMPLETE) {
            complete.incrementAndGet();
        } else if (report.status == ReportStatus.PARTIAL) {
            partial.incrementAndGet();
        } else {
            failed.incrementAndGet();
        }
    }
}
