package org.dxworks.sasframe.construct;

import org.dxworks.sasframe.token.Token;
import org.dxworks.sasframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Extracts table references and a complexity estimate from one PROC SQL statement.
 * <p>
 * SQL words are not SAS keywords, so matching is done on the upper-cased lexeme of identifier and
 * keyword tokens; literals and comments never match.
 */
final class SqlStatementAnalyzer {

    private static final Set<String> SET_OPERATORS = Set.of("UNION", "EXCEPT", "INTERSECT", "OUTER");
    private static final Set<String> CLAUSE_ENDS = Set.of("WHERE", "GROUP", "ORDER", "HAVING", "ON",
            "UNION", "EXCEPT", "INTERSECT", "LEFT", "RIGHT", "FULL", "INNER", "CROSS", "NATURAL", "JOIN");

    private SqlStatementAnalyzer() {
        // utility class
    }

    static ConstructDraft analyze(Statement statement) {
        List<Token> body = statement.body();
        String verb = statement.first().normalized();
        List<String> inputs = new ArrayList<>();
        List<String> outputs = new ArrayList<>();

        int joins = 0;
        int subqueries = 0;
        int setOperations = 0;
        int caseExpressions = 0;
        boolean grouped = false;
        boolean having = false;
        boolean passThrough = false;

        for (int i = 0; i < body.size(); i++) {
            Token token = body.get(i);
            String word = wordOf(token);
            if (token.isDelimiter("(") && i + 1 < body.size() && "SELECT".equals(wordOf(body.get(i + 1)))) {
                subqueries++;
            }
            if (word == null) {
                continue;
            }
            switch (word) {
                case "FROM" -> {
                    if (i + 1 < body.size() && "CONNECTION".equals(wordOf(body.get(i + 1)))) {
                        passThrough = true;
                    } else {
                        joins += Math.max(0, collectTableList(body, i + 1, inputs) - 1);
                    }
                }
                case "JOIN" -> {
                    joins++;
                    collectTable(body, i + 1, inputs);
                }
                case "TABLE", "VIEW" -> {
                    if (i > 0 && "CREATE".equals(wordOf(body.get(i - 1)))) {
                        collectTable(body, i + 1, outputs);
                    }
                }
                case "INTO" -> {
                    if (i > 0 && "INSERT".equals(wordOf(body.get(i - 1)))) {
                        collectTable(body, i + 1, outputs);
                    }
                }
                case "CASE" -> caseExpressions++;
                case "GROUP" -> grouped = true;
                case "HAVING" -> having = true;
                default -> {
                    if (SET_OPERATORS.contains(word) && !"OUTER".equals(word)) {
                        setOperations++;
                    }
                }
            }
        }

        if ("UPDATE".equals(verb)) {
            collectTable(body, 1, outputs);
        } else if ("DELETE".equals(verb) && outputs.isEmpty() && !inputs.isEmpty()) {
            outputs.add(inputs.get(0));
        } else if ("EXECUTE".equals(verb) && statement.indexOfKeyword("BY", 1) > 0) {
            passThrough = true;
        }

        int complexity = 1 + Math.max(joins, 0) + 2 * subqueries + setOperations + caseExpressions
                + (grouped ? 1 : 0) + (having ? 1 : 0);

        return ConstructDraft.leaf(ConstructKind.SQL_STATEMENT, statement)
                .with("sqlVerb", verb)
                .with("inputDatasets", inputs)
                .with("outputDatasets", outputs)
                .with("joinCount", Math.max(joins, 0))
                .with("subqueryCount", subqueries)
                .with("sqlComplexity", complexity)
                .with("passThrough", passThrough);
    }

    // Returns the number of tables in a comma separated FROM list.
    private static int collectTableList(List<Token> body, int from, List<String> sink) {
        int count = 0;
        int i = from;
        while (i < body.size()) {
            if (body.get(i).isDelimiter("(")) {
                i = DatasetNames.skipParentheses(body, i);
                count++;
            } else {
                if (collectTable(body, i, sink)) {
                    count++;
                }
                i++;
            }
            while (i < body.size() && !body.get(i).isDelimiter(",") && !isClauseEnd(body.get(i))) {
                if (body.get(i).isDelimiter("(")) {
                    i = DatasetNames.skipParentheses(body, i);
                } else {
                    i++;
                }
            }
            if (i < body.size() && body.get(i).isDelimiter(",")) {
                i++;
                continue;
            }
            break;
        }
        return count;
    }

    private static boolean collectTable(List<Token> body, int index, List<String> sink) {
        if (index >= body.size()) {
            return false;
        }
        Token token = body.get(index);
        if (token.kind != TokenKind.IDENTIFIER) {
            return false;
        }
        String name = DatasetNames.normalize(token.lexeme);
        if (name != null && !sink.contains(name)) {
            sink.add(name);
        }
        return true;
    }

    private static boolean isClauseEnd(Token token) {
        String word = wordOf(token);
        return word != null && CLAUSE_ENDS.contains(word);
    }

    private static String wordOf(Token token) {
        if (token.kind == TokenKind.IDENTIFIER || token.kind == TokenKind.KEYWORD) {
            return token.normalized();
        }
        return null;
    }
}
