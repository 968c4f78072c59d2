package org.dxworks.sasframe.token;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    OPERATOR,
    LITERAL,
    COMMENT,
    DELIMITER,
    UNKNOWN
}
