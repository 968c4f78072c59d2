package org.dxworks.sasframe.construct;

/**
 * Closed set of construct kinds. Stages dispatch on this tag with exhaustive switches, so adding a
 * kind is a compile-checked change in every stage that cares about it.
 */
public enum ConstructKind {
    /** Synthetic root, one per file. */
    PROGRAM,

    // Steps
    DATA_STEP,
    PROC_STEP,
    PROC_STATEMENT,
    SQL_STATEMENT,

    // Statements valid anywhere
    GLOBAL_STATEMENT,

    // DATA step statements
    SET_STATEMENT,
    MERGE_STATEMENT,
    UPDATE_STATEMENT,
    BY_STATEMENT,
    WHERE_STATEMENT,
    IF_THEN,
    ELSE,
    SELECT_BLOCK,
    WHEN_CLAUSE,
    OTHERWISE_CLAUSE,
    DO_BLOCK,
    DO_LOOP,
    ASSIGNMENT,
    SUM_STATEMENT,
    RETAIN_STATEMENT,
    ARRAY_STATEMENT,
    HASH_DECLARATION,
    VARIABLE_STATEMENT,
    OUTPUT_STATEMENT,
    CONTROL_STATEMENT,
    INPUT_STATEMENT,
    INFILE_STATEMENT,
    FILE_STATEMENT,
    PUT_STATEMENT,
    DATALINES,
    CALL_ROUTINE,
    EXPRESSION_STATEMENT,

    // Macro language
    MACRO_DEFINITION,
    MACRO_INVOCATION,
    MACRO_LET,
    MACRO_IF,
    MACRO_ELSE,
    MACRO_DO_BLOCK,
    MACRO_DO_LOOP,
    MACRO_STATEMENT,

    /** Statement the builder could not place; always reported, never dropped. */
    UNKNOWN
}
