package org.dxworks.sasframe.construct;

/**
 * Where a statement sits, decided by the nearest enclosing step or macro definition.
 */
enum StatementContext {
    OPEN_CODE,
    MACRO_BODY,
    DATA_STEP,
    PROC_SQL,
    PROC
}
