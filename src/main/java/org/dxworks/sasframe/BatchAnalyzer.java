package org.dxworks.sasframe;

import org.dxworks.sasframe.report.AnalysisError;
import org.dxworks.sasframe.report.AnalysisReport;
import org.dxworks.sasframe.report.ErrorType;
import org.dxworks.sasframe.report.FileIdentity;
import org.dxworks.sasframe.report.ReportAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Analyses many files in parallel, one independent pipeline per file.
 * <p>
 * At most {@code parallelism} files are in flight. Each file's clock starts when its analysis starts; a file
 * that exceeds the timeout is cancelled and reported as failed, and the rest of the batch carries on.
 */
public class BatchAnalyzer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final FileAnalyzer analyzer;
    private final Duration timeout;
    private final ExecutorService supervisors;
    private final ExecutorService workers;

    public BatchAnalyzer(FileAnalyzer analyzer, int parallelism, Duration timeout) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        this.analyzer = analyzer;
        this.timeout = timeout;
        this.supervisors = Executors.newFixedThreadPool(parallelism, namedDaemon("sasframe-batch"));
        this.workers = Executors.newCachedThreadPool(namedDaemon("sasframe-analysis"));
    }

    /**
     * Analyses every file and hands each report to {@code sink} as it completes. The sink is called from
     * pool threads, one report at a time per file, and must be thread-safe.
     */
    public void analyzeAll(List<Path> files, Consumer<AnalysisReport> sink) throws InterruptedException {
        List<Future<?>> pending = new ArrayList<>(files.size());
        for (Path file : files) {
            pending.add(supervisors.submit(() -> sink.accept(analyzeWithTimeout(file))));
        }
        try {
            for (Future<?> future : pending) {
                future.get();
            }
        } catch (ExecutionException e) {
            throw new IllegalStateException("report sink failed", e.getCause());
        } catch (InterruptedException e) {
            for (Future<?> future : pending) {
                future.cancel(true);
            }
            throw e;
        }
    }

    /** Reports in input order. */
    public List<AnalysisReport> analyzeAll(List<Path> files) throws InterruptedException {
        AnalysisReport[] reports = new AnalysisReport[files.size()];
        List<Path> indexed = List.copyOf(files);
        List<Future<AnalysisReport>> pending = new ArrayList<>(indexed.size());
        for (Path file : indexed) {
            pending.add(supervisors.submit(() -> analyzeWithTimeout(file)));
        }
        for (int i = 0; i < pending.size(); i++) {
            try {
                reports[i] = pending.get(i).get();
            } catch (ExecutionException e) {
                reports[i] = failure(indexed.get(i), ErrorType.INTERNAL, String.valueOf(e.getCause()));
            }
        }
        return List.of(reports);
    }

    AnalysisReport analyzeWithTimeout(Path file) {
        Future<AnalysisReport> future = workers.submit(() -> analyzer.analyze(file));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn("Analysis of {} exceeded {} s and was cancelled", file, timeout.toSeconds());
            return failure(file, ErrorType.TIMEOUT, "analysis exceeded the per-file timeout of "
                    + timeout.toSeconds() + " s");
        } catch (ExecutionException e) {
            LOGGER.error("Analysis of {} failed", file, e.getCause());
            return failure(file, ErrorType.INTERNAL, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return failure(file, ErrorType.INTERNAL, "analysis interrupted");
        }
    }

    private static AnalysisReport failure(Path file, ErrorType type, String message) {
        FileIdentity identity = new FileIdentity(file.toString(), String.valueOf(file.getFileName()), 0);
        return ReportAssembler.failed(identity, List.of(AnalysisError.of(type, message)));
    }

    @Override
    public void close() {
        supervisors.shutdownNow();
        workers.shutdownNow();
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
