package org.dxworks.sasframe.construct;

import org.dxworks.sasframe.token.Token;
import org.dxworks.sasframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns one statement into a construct draft. The role of a statement is decided by its first token's
 * kind and keyword plus the enclosing context, never by literal or comment text.
 */
final class StatementClassifier {

    static final String RUN = "RUN";
    static final String QUIT = "QUIT";
    static final String END = "END";
    static final String MEND = "%MEND";
    static final String MACRO_END = "%END";

    private static final Set<String> GLOBAL_KEYWORDS = Set.of("LIBNAME", "FILENAME", "OPTIONS", "ODS", "SYSTASK");
    private static final Set<String> VARIABLE_KEYWORDS = Set.of("KEEP", "DROP", "RENAME", "LENGTH", "FORMAT",
            "INFORMAT", "LABEL", "ATTRIB");
    private static final Set<String> CONTROL_KEYWORDS = Set.of("DELETE", "STOP", "RETURN", "LEAVE", "CONTINUE");
    private static final Set<String> DATALINES_KEYWORDS = Set.of("DATALINES", "DATALINES4", "CARDS", "CARDS4",
            "PARMCARDS");
    private static final Set<String> NODUPKEY_OPTIONS = Set.of("NODUPKEY", "NODUP", "NODUPRECS");
    // Interactive procedures: RUN ends a run group, only QUIT (or the next step) ends the procedure.
    private static final Set<String> RUN_GROUP_PROCS = Set.of("ANOVA", "CATALOG", "CHART", "DATASETS", "GCHART",
            "GLM", "GPLOT", "IML", "PLOT", "REG");
    // Programming statements some procedures accept in their bodies (PROC REPORT compute blocks, PROC FCMP).
    private static final Set<String> PROGRAM_KEYWORDS = Set.of("IF", "ELSE", "DO", "WHEN", "OTHERWISE");
    private static final Pattern LAG_FUNCTION = Pattern.compile("(LAG|DIF)[0-9]*");

    ConstructDraft dataStep(Statement statement) {
        ConstructDraft draft = ConstructDraft.step(ConstructKind.DATA_STEP, statement, RUN)
                .with("outputDatasets", DatasetNames.fromDatasetList(statement.body(), 1));
        return annotate(draft, statement);
    }

    ConstructDraft procStep(Statement statement) {
        List<Token> body = statement.body();
        String procName = statement.at(1) == null ? "" : statement.at(1).normalized();
        List<String> options = new ArrayList<>();
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();
        boolean nodupkey = false;

        int i = 2;
        while (i < body.size()) {
            Token token = body.get(i);
            if (token.isDelimiter("(")) {
                i = DatasetNames.skipParentheses(body, i);
                continue;
            }
            Token next = i + 1 < body.size() ? body.get(i + 1) : null;
            if (next != null && next.isOperator("=") && i + 2 < body.size()) {
                String name = token.normalized();
                Token value = body.get(i + 2);
                options.add(name + "=" + value.lexeme);
                switch (name) {
                    case "DATA" -> addDataset(inputs, value);
                    case "BASE" -> addDataset(outputs, value);
                    case "OUT", "OUT2", "OUTPUT" -> addDataset(outputs, value);
                    default -> {
                        // file references and plain options
                    }
                }
                i = DatasetNames.skipOptionValue(body, i + 2);
                continue;
            }
            options.add(token.normalized());
            nodupkey |= NODUPKEY_OPTIONS.contains(token.normalized());
            i++;
        }

        ConstructDraft draft = (RUN_GROUP_PROCS.contains(procName)
                ? ConstructDraft.step(ConstructKind.PROC_STEP, statement, QUIT)
                : ConstructDraft.step(ConstructKind.PROC_STEP, statement, RUN, QUIT))
                .with("procName", procName)
                .with("options", options)
                .with("inputDatasets", inputs)
                .with("outputDatasets", outputs)
                .with("nodupkey", nodupkey);
        return annotate(draft, statement);
    }

    ConstructDraft classify(Statement statement, StatementContext context) {
        return annotate(classifyInContext(statement, context), statement);
    }

    private ConstructDraft classifyInContext(Statement statement, StatementContext context) {
        Token first = statement.first();
        if (first.isMacroReference()) {
            return macroInvocation(statement);
        }
        String keyword = statement.keyword();
        if (keyword != null && keyword.startsWith("%")) {
            return macroStatement(statement, keyword);
        }
        if (isGlobalStatement(statement)) {
            return globalStatement(statement);
        }
        return switch (context) {
            case PROC_SQL -> SqlStatementAnalyzer.analyze(statement);
            case PROC -> procStatement(statement);
            case DATA_STEP, MACRO_BODY -> dataStepStatement(statement);
            case OPEN_CODE -> keyword != null && DATALINES_KEYWORDS.contains(datalinesWord(keyword))
                    ? ConstructDraft.leaf(ConstructKind.DATALINES, statement)
                    : ConstructDraft.leaf(ConstructKind.UNKNOWN, statement);
        };
    }

    // ---- DATA step ----

    private ConstructDraft dataStepStatement(Statement statement) {
        Token first = statement.first();
        Token second = statement.at(1);
        if (statement.isAssignment()) {
            return ConstructDraft.leaf(ConstructKind.ASSIGNMENT, statement)
                    .with("target", first.normalized());
        }
        if (first.kind == TokenKind.IDENTIFIER && second != null && second.isOperator("+")) {
            return ConstructDraft.leaf(ConstructKind.SUM_STATEMENT, statement)
                    .with("target", first.normalized());
        }

        String keyword = statement.keyword();
        if (keyword == null) {
            if (first.kind == TokenKind.IDENTIFIER && second != null && second.isDelimiter("(")) {
                return ConstructDraft.leaf(ConstructKind.EXPRESSION_STATEMENT, statement)
                        .with("callee", first.normalized());
            }
            return ConstructDraft.leaf(ConstructKind.UNKNOWN, statement);
        }

        return switch (keyword) {
            case "SET" -> datasetStatement(ConstructKind.SET_STATEMENT, statement);
            case "MERGE" -> datasetStatement(ConstructKind.MERGE_STATEMENT, statement);
            case "UPDATE", "MODIFY" -> datasetStatement(ConstructKind.UPDATE_STATEMENT, statement)
                    .with("keyword", keyword);
            case "BY" -> byStatement(ConstructDraft.leaf(ConstructKind.BY_STATEMENT, statement), statement);
            case "WHERE" -> ConstructDraft.leaf(ConstructKind.WHERE_STATEMENT, statement)
                    .with("condition", statement.text(1, statement.size()));
            case "IF" -> ifStatement(statement);
            case "ELSE" -> elseStatement(statement);
            case "DO" -> doStatement(statement);
            case "SELECT" -> ConstructDraft.block(ConstructKind.SELECT_BLOCK, statement, END)
                    .with("expression", statement.text(1, statement.size()));
            case "WHEN" -> clause(ConstructKind.WHEN_CLAUSE, statement);
            case "OTHERWISE" -> clause(ConstructKind.OTHERWISE_CLAUSE, statement);
            case "RETAIN" -> ConstructDraft.leaf(ConstructKind.RETAIN_STATEMENT, statement)
                    .with("variables", identifiers(statement, 1));
            case "ARRAY" -> ConstructDraft.leaf(ConstructKind.ARRAY_STATEMENT, statement)
                    .with("arrayName", statement.at(1) == null ? null : statement.at(1).normalized())
                    .with("temporary", containsWord(statement, "_TEMPORARY_"));
            case "DECLARE", "DCL" -> ConstructDraft.leaf(ConstructKind.HASH_DECLARATION, statement)
                    .with("objectType", statement.at(1) == null ? null : statement.at(1).normalized())
                    .with("objectName", statement.at(2) == null ? null : statement.at(2).normalized());
            case "KEEP", "DROP", "RENAME", "LENGTH", "FORMAT", "INFORMAT", "LABEL", "ATTRIB" ->
                    variableStatement(statement, keyword);
            case "OUTPUT" -> ConstructDraft.leaf(ConstructKind.OUTPUT_STATEMENT, statement)
                    .with("outputDatasets", DatasetNames.fromDatasetList(statement.body(), 1));
            case "DELETE", "STOP", "RETURN", "LEAVE", "CONTINUE" ->
                    ConstructDraft.leaf(ConstructKind.CONTROL_STATEMENT, statement).with("keyword", keyword);
            case "INPUT" -> inputStatement(statement);
            case "INFILE" -> ConstructDraft.leaf(ConstructKind.INFILE_STATEMENT, statement)
                    .with("source", statement.at(1) == null ? null : statement.at(1).lexeme);
            case "FILE" -> ConstructDraft.leaf(ConstructKind.FILE_STATEMENT, statement)
                    .with("target", statement.at(1) == null ? null : statement.at(1).lexeme);
            case "PUT" -> ConstructDraft.leaf(ConstructKind.PUT_STATEMENT, statement);
            case "CALL" -> ConstructDraft.leaf(ConstructKind.CALL_ROUTINE, statement)
                    .with("routine", statement.at(1) == null ? null : statement.at(1).normalized());
            default -> DATALINES_KEYWORDS.contains(datalinesWord(keyword))
                    ? ConstructDraft.leaf(ConstructKind.DATALINES, statement)
                    : ConstructDraft.leaf(ConstructKind.UNKNOWN, statement);
        };
    }

    private ConstructDraft datasetStatement(ConstructKind kind, Statement statement) {
        List<String> inputs = DatasetNames.fromDatasetList(statement.body(), 1);
        return ConstructDraft.leaf(kind, statement)
                .with("inputDatasets", inputs)
                .with("inputCount", inputs.size());
    }

    private ConstructDraft byStatement(ConstructDraft draft, Statement statement) {
        List<String> variables = new ArrayList<>();
        List<String> descending = new ArrayList<>();
        boolean descendingNext = false;
        for (int i = 1; i < statement.size(); i++) {
            Token token = statement.at(i);
            if (token.kind != TokenKind.IDENTIFIER) {
                continue;
            }
            String word = token.normalized();
            if ("DESCENDING".equals(word)) {
                descendingNext = true;
            } else if ("NOTSORTED".equals(word) || "GROUPFORMAT".equals(word)) {
                draft.with("notsorted", "NOTSORTED".equals(word) ? Boolean.TRUE : null);
            } else {
                variables.add(word);
                if (descendingNext) {
                    descending.add(word);
                }
                descendingNext = false;
            }
        }
        return draft.with("byVariables", variables).with("descending", descending);
    }

    private ConstructDraft ifStatement(Statement statement) {
        int thenIndex = statement.indexOfKeyword("THEN", 1);
        if (thenIndex < 0) {
            return ConstructDraft.leaf(ConstructKind.IF_THEN, statement)
                    .with("condition", statement.text(1, statement.size()))
                    .with("subsetting", true);
        }
        String condition = statement.text(1, thenIndex);
        Token action = statement.at(thenIndex + 1);
        if (action != null && action.isKeyword("DO")) {
            return ConstructDraft.block(ConstructKind.IF_THEN, statement, END)
                    .with("condition", condition)
                    .with("subsetting", false);
        }
        return ConstructDraft.leaf(ConstructKind.IF_THEN, statement)
                .with("condition", condition)
                .with("subsetting", false)
                .with("action", statement.text(thenIndex + 1, statement.size()));
    }

    private ConstructDraft elseStatement(Statement statement) {
        Token second = statement.at(1);
        boolean elseIf = second != null && second.isKeyword("IF");
        boolean opensBlock;
        if (elseIf) {
            int thenIndex = statement.indexOfKeyword("THEN", 2);
            Token action = thenIndex < 0 ? null : statement.at(thenIndex + 1);
            opensBlock = action != null && action.isKeyword("DO");
        } else {
            opensBlock = second != null && second.isKeyword("DO");
        }
        ConstructDraft draft = opensBlock
                ? ConstructDraft.block(ConstructKind.ELSE, statement, END)
                : ConstructDraft.leaf(ConstructKind.ELSE, statement);
        return draft.with("elseIf", elseIf);
    }

    private ConstructDraft doStatement(Statement statement) {
        if (statement.size() == 1) {
            return ConstructDraft.block(ConstructKind.DO_BLOCK, statement, END);
        }
        Token second = statement.at(1);
        String loopType;
        if (second.isKeyword("WHILE")) {
            loopType = "while";
        } else if (second.isKeyword("UNTIL")) {
            loopType = "until";
        } else if (second.isKeyword("OVER")) {
            loopType = "over";
        } else {
            loopType = "iterative";
        }
        return ConstructDraft.block(ConstructKind.DO_LOOP, statement, END)
                .with("loopType", loopType)
                .with("loopVariable", "iterative".equals(loopType) ? second.normalized() : null);
    }

    private ConstructDraft clause(ConstructKind kind, Statement statement) {
        ConstructDraft draft = statement.endsWithKeywords("DO")
                ? ConstructDraft.block(kind, statement, END)
                : ConstructDraft.leaf(kind, statement);
        Token second = statement.at(1);
        if (kind == ConstructKind.WHEN_CLAUSE && second != null && second.isDelimiter("(")) {
            int close = DatasetNames.skipParentheses(statement.body(), 1);
            draft.with("condition", statement.text(2, close - 1));
        }
        return draft;
    }

    private ConstructDraft variableStatement(Statement statement, String keyword) {
        ConstructDraft draft = ConstructDraft.leaf(ConstructKind.VARIABLE_STATEMENT, statement)
                .with("keyword", keyword);
        if ("KEEP".equals(keyword) || "DROP".equals(keyword)) {
            draft.with("variables", identifiers(statement, 1));
        }
        return draft;
    }

    private ConstructDraft inputStatement(Statement statement) {
        int pointerControls = 0;
        int last = statement.size() - 1;
        for (int i = 1; i <= last; i++) {
            Token token = statement.at(i);
            if ((token.isOperator("@") && i != last) || token.isOperator("#")) {
                pointerControls++;
            }
        }
        Token trailing = statement.at(last);
        String lineHold = "none";
        if (last > 0 && trailing.isOperator("@@")) {
            lineHold = "double";
        } else if (last > 0 && trailing.isOperator("@")) {
            lineHold = "single";
        }
        return ConstructDraft.leaf(ConstructKind.INPUT_STATEMENT, statement)
                .with("pointerControls", pointerControls)
                .with("lineHold", lineHold);
    }

    // ---- PROC bodies ----

    private ConstructDraft procStatement(Statement statement) {
        String keyword = statement.first().normalized();
        if (statement.keyword() != null && (PROGRAM_KEYWORDS.contains(keyword) || isSelectBlock(statement))) {
            return dataStepStatement(statement);
        }
        ConstructDraft draft = ConstructDraft.leaf(ConstructKind.PROC_STATEMENT, statement)
                .with("keyword", keyword);
        switch (keyword) {
            case "BY" -> byStatement(draft, statement);
            case "WHERE" -> draft.with("condition", statement.text(1, statement.size()));
            case "OUTPUT" -> draft.with("outputDatasets", optionDatasets(statement, "OUT"));
            default -> {
                // VAR, CLASS, TABLES, MODEL, ... carry no attributes beyond the keyword
            }
        }
        if (DATALINES_KEYWORDS.contains(datalinesWord(keyword))) {
            return ConstructDraft.leaf(ConstructKind.DATALINES, statement);
        }
        return draft;
    }

    // SELECT; or SELECT(expr); opens a block, while PROC DATASETS' SELECT names members.
    private static boolean isSelectBlock(Statement statement) {
        if (!statement.first().isKeyword("SELECT")) {
            return false;
        }
        Token second = statement.at(1);
        return second == null || second.isDelimiter("(");
    }

    private List<String> optionDatasets(Statement statement, String option) {
        List<String> datasets = new ArrayList<>();
        List<Token> body = statement.body();
        for (int i = 0; i + 2 < body.size(); i++) {
            if (option.equals(body.get(i).normalized()) && body.get(i + 1).isOperator("=")) {
                addDataset(datasets, body.get(i + 2));
            }
        }
        return datasets;
    }

    // ---- Global and macro statements ----

    private boolean isGlobalStatement(Statement statement) {
        Token first = statement.first();
        if (first.kind == TokenKind.KEYWORD) {
            String keyword = first.normalized();
            return GLOBAL_KEYWORDS.contains(keyword) || keyword.startsWith("TITLE") || keyword.startsWith("FOOTNOTE");
        }
        Token second = statement.at(1);
        return first.kind == TokenKind.IDENTIFIER && "X".equals(first.normalized())
                && second != null && second.kind == TokenKind.LITERAL;
    }

    private ConstructDraft globalStatement(Statement statement) {
        String keyword = statement.first().normalized();
        ConstructDraft draft = ConstructDraft.leaf(ConstructKind.GLOBAL_STATEMENT, statement)
                .with("keyword", keyword);
        if (("LIBNAME".equals(keyword) || "FILENAME".equals(keyword)) && statement.at(1) != null) {
            draft.with("reference", statement.at(1).normalized());
        }
        return draft;
    }

    private ConstructDraft macroStatement(Statement statement, String keyword) {
        return switch (keyword) {
            case "%MACRO" -> macroDefinition(statement);
            case "%LET" -> ConstructDraft.leaf(ConstructKind.MACRO_LET, statement)
                    .with("variable", statement.at(1) == null ? null : statement.at(1).normalized());
            case "%IF" -> macroIf(statement);
            case "%ELSE" -> (statement.endsWithKeywords("%DO")
                    ? ConstructDraft.block(ConstructKind.MACRO_ELSE, statement, MACRO_END)
                    : ConstructDraft.leaf(ConstructKind.MACRO_ELSE, statement));
            case "%DO" -> macroDo(statement);
            default -> ConstructDraft.leaf(ConstructKind.MACRO_STATEMENT, statement).with("keyword", keyword);
        };
    }

    private ConstructDraft macroDefinition(Statement statement) {
        Token nameToken = statement.at(1);
        List<String> parameters = new ArrayList<>();
        Token open = statement.at(2);
        if (open != null && open.isDelimiter("(")) {
            for (List<Token> argument : splitArguments(statement.body(), 2)) {
                if (!argument.isEmpty()) {
                    parameters.add(argument.get(0).normalized());
                }
            }
        }
        return ConstructDraft.block(ConstructKind.MACRO_DEFINITION, statement, MEND)
                .with("macroName", nameToken == null ? "" : nameToken.normalized())
                .with("parameters", parameters)
                .with("recursive", false)
                .with("recursion", "none");
    }

    private ConstructDraft macroIf(Statement statement) {
        int thenIndex = statement.indexOfKeyword("%THEN", 1);
        String condition = statement.text(1, thenIndex < 0 ? statement.size() : thenIndex);
        ConstructDraft draft = statement.endsWithKeywords("%THEN", "%DO")
                ? ConstructDraft.block(ConstructKind.MACRO_IF, statement, MACRO_END)
                : ConstructDraft.leaf(ConstructKind.MACRO_IF, statement);
        return draft.with("condition", condition);
    }

    private ConstructDraft macroDo(Statement statement) {
        if (statement.size() == 1) {
            return ConstructDraft.block(ConstructKind.MACRO_DO_BLOCK, statement, MACRO_END);
        }
        Token second = statement.at(1);
        String loopType;
        if (second.isKeyword("%WHILE")) {
            loopType = "while";
        } else if (second.isKeyword("%UNTIL")) {
            loopType = "until";
        } else {
            loopType = "iterative";
        }
        return ConstructDraft.block(ConstructKind.MACRO_DO_LOOP, statement, MACRO_END)
                .with("loopType", loopType);
    }

    private ConstructDraft macroInvocation(Statement statement) {
        String name = statement.first().normalized().substring(1);
        List<String> arguments = new ArrayList<>();
        Token open = statement.at(1);
        if (open != null && open.isDelimiter("(")) {
            for (List<Token> argument : splitArguments(statement.body(), 1)) {
                arguments.add(Statement.textOf(argument, 0, argument.size()));
            }
        }
        return ConstructDraft.leaf(ConstructKind.MACRO_INVOCATION, statement)
                .with("macroName", name)
                .with("arguments", arguments);
    }

    // ---- helpers ----

    // Adds usesLag, byGroupProcessing and platformConcerns where the statement shows them.
    private ConstructDraft annotate(ConstructDraft draft, Statement statement) {
        List<Token> body = statement.body();
        for (int i = 0; i < body.size(); i++) {
            Token token = body.get(i);
            if (token.kind != TokenKind.IDENTIFIER) {
                continue;
            }
            String word = token.normalized();
            if (LAG_FUNCTION.matcher(word).matches() && i + 1 < body.size() && body.get(i + 1).isDelimiter("(")) {
                draft.with("usesLag", true);
            }
            if (word.startsWith("FIRST.") || word.startsWith("LAST.")) {
                draft.with("byGroupProcessing", true);
            }
        }
        List<String> concerns = PlatformConcerns.detect(statement);
        if (!concerns.isEmpty()) {
            draft.with("platformConcerns", concerns);
        }
        return draft;
    }

    /** Splits the parenthesised list opening at {@code openIndex} on top-level commas. */
    static List<List<Token>> splitArguments(List<Token> tokens, int openIndex) {
        List<List<Token>> arguments = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isDelimiter("(")) {
                depth++;
                if (depth == 1) {
                    continue;
                }
            } else if (token.isDelimiter(")")) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (depth == 1 && token.isDelimiter(",")) {
                arguments.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        if (!current.isEmpty() || !arguments.isEmpty()) {
            arguments.add(current);
        }
        return arguments;
    }

    static boolean isDatalines(Token token) {
        return token.kind == TokenKind.KEYWORD && DATALINES_KEYWORDS.contains(datalinesWord(token.normalized()));
    }

    // DATALINES_START tokens carry their own ';' ("DATALINES;").
    private static String datalinesWord(String keyword) {
        int end = 0;
        while (end < keyword.length() && Character.isLetterOrDigit(keyword.charAt(end))) {
            end++;
        }
        return keyword.substring(0, end);
    }

    private static List<String> identifiers(Statement statement, int from) {
        List<String> names = new ArrayList<>();
        for (int i = from; i < statement.size(); i++) {
            Token token = statement.at(i);
            if (token.kind == TokenKind.IDENTIFIER && !names.contains(token.normalized())) {
                names.add(token.normalized());
            }
        }
        return names;
    }

    private static boolean containsWord(Statement statement, String word) {
        for (Token token : statement.body()) {
            if (word.equals(token.normalized())) {
                return true;
            }
        }
        return false;
    }

    private static void addDataset(List<String> sink, Token token) {
        if (token.kind != TokenKind.IDENTIFIER) {
            return;
        }
        String name = DatasetNames.normalize(token.lexeme);
        if (name != null && !"_NULL_".equals(name) && !sink.contains(name)) {
            sink.add(name);
        }
    }
}
