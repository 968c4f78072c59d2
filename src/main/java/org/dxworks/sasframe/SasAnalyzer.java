package org.dxworks.sasframe;

import org.dxworks.sasframe.blueprint.BlueprintEntry;
import org.dxworks.sasframe.blueprint.BlueprintGenerator;
import org.dxworks.sasframe.complexity.ComplexityAnalyzer;
import org.dxworks.sasframe.complexity.ComplexityReport;
import org.dxworks.sasframe.construct.ConstructBuilder;
import org.dxworks.sasframe.construct.ConstructTree;
import org.dxworks.sasframe.error.ExternalLexException;
import org.dxworks.sasframe.lexer.LexDiagnostic;
import org.dxworks.sasframe.lexer.SasTokenizer;
import org.dxworks.sasframe.lexer.TokenStreamResult;
import org.dxworks.sasframe.report.AnalysisError;
import org.dxworks.sasframe.report.AnalysisReport;
import org.dxworks.sasframe.report.ErrorType;
import org.dxworks.sasframe.report.FileIdentity;
import org.dxworks.sasframe.report.ReportAssembler;
import org.dxworks.sasframe.risk.ClassificationResult;
import org.dxworks.sasframe.risk.RiskClassifier;
import org.dxworks.sasframe.rules.Registries;
import org.dxworks.sasframe.token.Token;
import org.dxworks.sasframe.token.TokenAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Single-file pipeline: tokenize, adapt, build, score, classify, map, assemble. Stages run strictly in
 * sequence; the only shared state is the read-only registries, so one instance can serve many threads.
 */
public class SasAnalyzer implements FileAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SasAnalyzer.class);

    private final Registries registries;
    private final SasTokenizer tokenizer = new SasTokenizer();
    private final TokenAdapter adapter = new TokenAdapter();
    private final ConstructBuilder builder = new ConstructBuilder();
    private final ComplexityAnalyzer complexityAnalyzer;
    private final RiskClassifier classifier = new RiskClassifier();
    private final BlueprintGenerator generator = new BlueprintGenerator();
    private final ReportAssembler assembler;

    public SasAnalyzer(Registries registries) {
        this.registries = registries;
        this.complexityAnalyzer = new ComplexityAnalyzer(registries.getComplexityWeights());
        this.assembler = new ReportAssembler(registries.getReadinessWeights(), registries.recommendations());
    }

    @Override
    public AnalysisReport analyze(Path file) {
        String source;
        try {
            source = read(file);
        } catch (IOException e) {
            LOGGER.warn("Cannot read {}: {}", file, e.getMessage());
            FileIdentity identity = new FileIdentity(file.toString(), String.valueOf(file.getFileName()), 0);
            return ReportAssembler.failed(identity,
                    List.of(AnalysisError.of(ErrorType.INTERNAL, "cannot read file: " + e.getMessage())));
        }
        return analyze(file.toString(), source);
    }

    public AnalysisReport analyze(String path, String source) {
        FileIdentity identity = FileIdentity.of(path, source);
        try {
            TokenStreamResult raw = tokenizer.tokenize(source);
            List<Token> tokens = adapter.adapt(raw, source).toList();
            checkInterrupted();
            ConstructTree tree = builder.build(tokens);
            checkInterrupted();
            ComplexityReport complexity = complexityAnalyzer.analyze(tree);
            ClassificationResult classification = classifier.classify(tree, registries.getRiskRules());
            checkInterrupted();
            List<BlueprintEntry> blueprint = generator.generate(tree, registries.getMappingRules());
            return assembler.assemble(identity, tree, complexity, classification, blueprint, lexicalWarnings(raw));
        } catch (ExternalLexException e) {
            LOGGER.warn("Lexing failed for {}: {}", path, e.getMessage());
            return ReportAssembler.failed(identity,
                    List.of(AnalysisError.atLine(ErrorType.EXTERNAL_LEX, e.getMessage(), e.getLine())));
        } catch (CancellationException e) {
            return ReportAssembler.failed(identity, List.of(AnalysisError.of(ErrorType.TIMEOUT, e.getMessage())));
        } catch (RuntimeException e) {
            LOGGER.error("Internal failure while analysing {}", path, e);
            return ReportAssembler.failed(identity,
                    List.of(AnalysisError.of(ErrorType.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage())));
        }
    }

    private static List<AnalysisError> lexicalWarnings(TokenStreamResult raw) {
        List<AnalysisError> warnings = new ArrayList<>();
        for (LexDiagnostic diagnostic : raw.diagnostics) {
            if (!diagnostic.fatal) {
                warnings.add(AnalysisError.atLine(ErrorType.LEXICAL_WARNING, diagnostic.message, diagnostic.line));
            }
        }
        return warnings;
    }

    // A timed-out file is cancelled through interruption; stop between stages.
    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("analysis cancelled");
        }
    }

    static String read(Path file) throws IOException {
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            return source.startsWith("\uFEFF") ? source.substring(1) : source;
        } catch (MalformedInputException e) {
            // legacy SAS sources are often Latin-1
            return Files.readString(file, StandardCharsets.ISO_8859_1);
        }
    }
}
