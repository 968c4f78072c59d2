package org.dxworks.sasframe.construct;

import org.dxworks.sasframe.token.Token;
import org.dxworks.sasframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Dataset-name helpers shared by statement classification and complexity analysis.
 */
public final class DatasetNames {

    private static final String WORK_PREFIX = "WORK.";

    private DatasetNames() {
        // utility class
    }

    /** Upper case, trailing dots removed, the default {@code WORK} library dropped. */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String name = raw.trim().toUpperCase(Locale.ROOT);
        while (name.endsWith(".")) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.startsWith(WORK_PREFIX)) {
            name = name.substring(WORK_PREFIX.length());
        }
        return name.isEmpty() ? null : name;
    }

    /**
     * Collects dataset names from a dataset list such as {@code a b(keep=x) end=eof}, starting at
     * {@code from}. Parenthesised dataset options and {@code name=value} statement options are skipped;
     * scanning stops at {@code /}.
     */
    static List<String> fromDatasetList(List<Token> tokens, int from) {
        List<String> names = new ArrayList<>();
        int i = from;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (token.isDelimiter("(")) {
                i = skipParentheses(tokens, i);
                continue;
            }
            if (token.isOperator("/")) {
                break;
            }
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            if (next != null && next.isOperator("=")) {
                i = skipOptionValue(tokens, i + 2);
                continue;
            }
            if (token.kind == TokenKind.IDENTIFIER && !"_NULL_".equals(token.normalized())) {
                String name = normalize(token.lexeme);
                if (name != null && !names.contains(name)) {
                    names.add(name);
                }
            }
            i++;
        }
        return names;
    }

    /** Returns the index just after the parenthesis closing the one at {@code openIndex}. */
    static int skipParentheses(List<Token> tokens, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isDelimiter("(")) {
                depth++;
            } else if (token.isDelimiter(")")) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return tokens.size();
    }

    // A value is one token, optionally followed by a parenthesised option list (out=x(keep=a)).
    static int skipOptionValue(List<Token> tokens, int valueIndex) {
        if (valueIndex < tokens.size() && tokens.get(valueIndex).isDelimiter("(")) {
            return skipParentheses(tokens, valueIndex);
        }
        int i = valueIndex + 1;
        if (i < tokens.size() && tokens.get(i).isDelimiter("(")) {
            return skipParentheses(tokens, i);
        }
        return i;
    }
}
