package org.dxworks.sasframe.complexity;

public enum TranslationPriority {
    LOW,
    MEDIUM,
    HIGH
}
