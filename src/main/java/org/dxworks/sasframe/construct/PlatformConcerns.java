package org.dxworks.sasframe.construct;

import org.dxworks.sasframe.token.Token;
import org.dxworks.sasframe.token.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Detects host-specific code: shell escapes, pipes and hard-coded Windows paths.
 */
final class PlatformConcerns {

    private static final Pattern WINDOWS_DRIVE_PATH = Pattern.compile("^['\"][A-Za-z]:[\\\\/].*", Pattern.DOTALL);
    private static final Pattern UNC_PATH = Pattern.compile("^['\"]\\\\\\\\.*", Pattern.DOTALL);

    private PlatformConcerns() {
        // utility class
    }

    static List<String> detect(Statement statement) {
        List<String> concerns = new ArrayList<>();
        Token first = statement.first();
        Token second = statement.at(1);
        String keyword = first.normalized();

        if (first.kind == TokenKind.IDENTIFIER && "X".equals(keyword)
                && second != null && second.kind == TokenKind.LITERAL) {
            add(concerns, "X command");
        }
        if (first.kind == TokenKind.KEYWORD) {
            switch (keyword) {
                case "%SYSEXEC" -> add(concerns, "%SYSEXEC host command");
                case "SYSTASK" -> add(concerns, "SYSTASK host command");
                case "CALL" -> {
                    if (second != null && "SYSTEM".equals(second.normalized())) {
                        add(concerns, "CALL SYSTEM host command");
                    }
                }
                default -> {
                    // no statement-level concern
                }
            }
        }

        for (Token token : statement.body()) {
            if (token.kind == TokenKind.IDENTIFIER && "PIPE".equals(token.normalized())
                    && first.isKeyword("FILENAME")) {
                add(concerns, "FILENAME PIPE");
            }
            if (token.kind == TokenKind.LITERAL) {
                if (WINDOWS_DRIVE_PATH.matcher(token.lexeme).matches()) {
                    add(concerns, "Windows drive path");
                } else if (UNC_PATH.matcher(token.lexeme).matches()) {
                    add(concerns, "UNC network path");
                }
            }
        }
        return concerns;
    }

    private static void add(List<String> concerns, String concern) {
        if (!concerns.contains(concern)) {
            concerns.add(concern);
        }
    }
}
