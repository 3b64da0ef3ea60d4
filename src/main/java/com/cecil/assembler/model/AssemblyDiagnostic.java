package com.cecil.assembler.model;

/**
 * Non-fatal condition recovered during an assembly run.
 *
 * @param kind    what was recovered
 * @param subject variable name or file location it concerns
 * @param message human-readable detail
 */
public record AssemblyDiagnostic(Kind kind, String subject, String message) {

    public enum Kind {
        EMPTY_VARIABLE,
        EXCLUDED_VARIABLE,
        UNREADABLE_FILE,
        DISCARDED_PLANES,
        MISSING_TIMESTAMP
    }
}
