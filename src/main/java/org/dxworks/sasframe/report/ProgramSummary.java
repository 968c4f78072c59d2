package org.dxworks.sasframe.report;

import org.dxworks.sasframe.complexity.TranslationPriority;

import java.util.ArrayList;
import java.util.List;

/**
 * Headline numbers for a file: step and macro counts, data flow, priority band and recommendations.
 */
public class ProgramSummary {
    public int dataSteps;
    public int procBlocks;
    public int procSqlBlocks;
    public int macroDefinitions;
    public int macroCalls;
    public List<String> procTypes = new ArrayList<>();
    public List<String> datasetsCreated = new ArrayList<>();
    public List<String> datasetsUsed = new ArrayList<>();
    public int totalLines;
    public int totalTokens;
    public double complexityScore;
    public TranslationPriority translationPriority;
    public String confidenceAssessment;
    public List<String> recommendations = new ArrayList<>();
}
