package org.dxworks.sasframe.report;

public enum ErrorType {
    EXTERNAL_LEX,
    LEXICAL_WARNING,
    STRUCTURAL,
    RULE_EVALUATION,
    TIMEOUT,
    INTERNAL
}
