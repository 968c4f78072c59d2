package org.dxworks.sasframe.rules;

/**
 * Operations of the target-platform intermediate representation (dataframe or SQL).
 */
public enum TargetOperationKind {
    READ,
    WRITE,
    FILTER,
    PROJECT,
    RENAME,
    ASSIGN_COLUMN,
    CAST,
    JOIN,
    CONCAT,
    SORT,
    DEDUPLICATE,
    GROUP_BY,
    AGGREGATE,
    PIVOT,
    WINDOW,
    CONDITIONAL,
    LOOP,
    BLOCK,
    FUNCTION_DEFINITION,
    VARIABLE_ASSIGNMENT,
    LOG,
    DISPLAY,
    DESCRIBE,
    MODEL,
    CONNECTION,
    NO_OP,
    RAW_SQL
}
