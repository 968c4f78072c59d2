package org.dxworks.sasframe;

import org.dxworks.sasframe.report.AnalysisReport;

import java.nio.file.Path;

/**
 * Analyses one file. Implementations report failures inside the returned report instead of throwing.
 */
@FunctionalInterface
public interface FileAnalyzer {

    AnalysisReport analyze(Path file);
}
