package org.dxworks.sasframe;

import org.approvaltests.Approvals;
import org.dxworks.sasframe.construct.Construct;
import org.dxworks.sasframe.report.AnalysisError;
import org.dxworks.sasframe.report.AnalysisReport;
import org.dxworks.sasframe.rules.RegistryLoader;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.sasframe.TestUtils.APPROVAL_MAPPER;
import static org.dxworks.sasframe.TestUtils.SAMPLES_BASE_PATH;

/**
 * Approves the structure of each sample report: status, errors, summary and the construct outline.
 * Scores and offsets are covered by the focused tests.
 */
public class SasAnalyzeApprovalTest {

    private static final SasAnalyzer ANALYZER = new SasAnalyzer(new RegistryLoader().loadDefault());

    @Test
    void analyze_Sas_SalesReport() throws IOException {
        verify("sales_report.sas");
    }

    @Test
    void analyze_Sas_MacroRecursion() throws IOException {
        verify("macro_recursion.sas");
    }

    @Test
    void analyze_Sas_ProcSql() throws IOException {
        verify("proc_sql.sas");
    }

    @Test
    void analyze_Sas_LegacyInput() throws IOException {
        verify("legacy_input.sas");
    }

    @Test
    void analyze_Sas_Unbalanced() throws IOException {
        verify("unbalanced.sas");
    }

    @Test
    void analyze_Sas_UnterminatedString() throws IOException {
        verify("unterminated_string.sas");
    }

    private static void verify(String fileName) throws IOException {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + fileName);
        AnalysisReport report = ANALYZER.analyze(filePath);
        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(outline(report)) + "\n");
    }

    private static Map<String, Object> outline(AnalysisReport report) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("file", report.file.fileName);
        view.put("status", report.status);
        List<String> errors = new ArrayList<>();
        for (AnalysisError error : report.errors) {
            errors.add(error.type.name() + " @" + error.line);
        }
        view.put("errors", errors);
        if (report.summary != null) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("dataSteps", report.summary.dataSteps);
            summary.put("procBlocks", report.summary.procBlocks);
            summary.put("procSqlBlocks", report.summary.procSqlBlocks);
            summary.put("macroDefinitions", report.summary.macroDefinitions);
            summary.put("macroCalls", report.summary.macroCalls);
            summary.put("procTypes", report.summary.procTypes);
            summary.put("datasetsCreated", report.summary.datasetsCreated);
            summary.put("datasetsUsed", report.summary.datasetsUsed);
            summary.put("totalLines", report.summary.totalLines);
            view.put("summary", summary);
        }
        if (report.constructs != null) {
            List<String> lines = new ArrayList<>();
            for (Construct child : report.constructs.children) {
                describe(child, "", lines);
            }
            view.put("constructs", lines);
        }
        return view;
    }

    // One line per construct, indented by depth: KIND [name] @line.
    private static void describe(Construct construct, String indent, List<String> lines) {
        StringBuilder line = new StringBuilder(indent).append(construct.kind);
        String name = construct.stringAttribute("procName");
        if (name == null) {
            name = construct.stringAttribute("macroName");
        }
        if (name != null) {
            line.append(' ').append(name);
        }
        lines.add(line.append(" @").append(construct.span.line).toString());
        for (Construct child : construct.children) {
            describe(child, indent + "  ", lines);
        }
    }
}
