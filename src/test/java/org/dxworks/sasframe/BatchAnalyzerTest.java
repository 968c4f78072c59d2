package org.dxworks.sasframe;

import org.dxworks.sasframe.report.AnalysisError;
import org.dxworks.sasframe.report.AnalysisReport;
import org.dxworks.sasframe.report.ErrorType;
import org.dxworks.sasframe.report.FileIdentity;
import org.dxworks.sasframe.report.ReportAssembler;
import org.dxworks.sasframe.report.ReportStatus;
import org.dxworks.sasframe.rules.RegistryLoader;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BatchAnalyzerTest {

    private static final SasAnalyzer ANALYZER = new SasAnalyzer(new RegistryLoader().loadDefault());

    /** Hangs on any file named {@code slow.sas}, analyses everything else from an inline program. */
    private static final FileAnalyzer HANGING = file -> {
        if ("slow.sas".equals(file.getFileName().toString())) {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ReportAssembler.failed(new FileIdentity(file.toString(), "slow.sas", 0),
                        List.of(AnalysisError.of(ErrorType.INTERNAL, "interrupted")));
            }
        }
        return ANALYZER.analyze(file.toString(), "data a;\n  x = 1;\nrun;\n");
    };

    @Test
    void analyzeAll_TimeoutOnlyAffectsSlowFile() throws Exception {
        try (BatchAnalyzer batch = new BatchAnalyzer(HANGING, 2, Duration.ofMillis(200))) {
            List<AnalysisReport> reports = batch.analyzeAll(List.of(
                    Paths.get("first.sas"), Paths.get("slow.sas"), Paths.get("last.sas")));

            assertEquals(3, reports.size());
            assertEquals(ReportStatus.COMPLETE, reports.get(0).status);
            assertEquals(ReportStatus.FAILED, reports.get(1).status);
            assertEquals(ErrorType.TIMEOUT, reports.get(1).errors.get(0).type);
            assertEquals("slow.sas", reports.get(1).file.fileName);
            assertEquals(ReportStatus.COMPLETE, reports.get(2).status);
        }
    }

    @Test
    void analyzeAll_ReportsFollowInputOrder() throws Exception {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            files.add(Paths.get("file" + i + ".sas"));
        }

        try (BatchAnalyzer batch = new BatchAnalyzer(HANGING, 4, Duration.ofSeconds(10))) {
            List<AnalysisReport> reports = batch.analyzeAll(files);

            for (int i = 0; i < files.size(); i++) {
                assertEquals(files.get(i).toString(), reports.get(i).file.path);
            }
        }
    }

    @Test
    void analyzeAll_SinkReceivesEveryReport() throws Exception {
        List<AnalysisReport> received = Collections.synchronizedList(new ArrayList<>());

        try (BatchAnalyzer batch = new BatchAnalyzer(ANALYZER, 3, Duration.ofSeconds(10))) {
            batch.analyzeAll(List.of(
                    Paths.get(TestUtils.SAMPLES_BASE_PATH + "sales_report.sas"),
                    Paths.get(TestUtils.SAMPLES_BASE_PATH + "unbalanced.sas"),
                    Paths.get(TestUtils.SAMPLES_BASE_PATH + "unterminated_string.sas")), received::add);
        }

        Set<String> names = received.stream().map(report -> report.file.fileName).collect(Collectors.toSet());
        assertEquals(Set.of("sales_report.sas", "unbalanced.sas", "unterminated_string.sas"), names);
    }

    @Test
    void analyzeAll_EmptyBatch() throws Exception {
        try (BatchAnalyzer batch = new BatchAnalyzer(ANALYZER, 1, Duration.ofSeconds(1))) {
            assertEquals(List.of(), batch.analyzeAll(List.of()));
        }
    }

    @Test
    void analyzeWithTimeout_FailingAnalyzerIsInternalError() {
        FileAnalyzer broken = file -> {
            throw new IllegalStateException("boom");
        };

        try (BatchAnalyzer batch = new BatchAnalyzer(broken, 1, Duration.ofSeconds(1))) {
            AnalysisReport report = batch.analyzeWithTimeout(Paths.get("x.sas"));

            assertEquals(ReportStatus.FAILED, report.status);
            assertEquals(ErrorType.INTERNAL, report.errors.get(0).type);
        }
    }

    @Test
    void constructor_RejectsNonPositiveParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new BatchAnalyzer(ANALYZER, 0, Duration.ofSeconds(1)));
    }
}
