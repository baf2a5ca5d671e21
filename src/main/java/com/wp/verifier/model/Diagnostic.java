package com.wp.verifier.model;

import java.util.Objects;

/**
 * A warning or error recorded while building or verifying a function that is not itself a
 * verification result.
 */
public final class Diagnostic {

    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    public enum Code {
        MISSING_INVARIANT,
        MISSING_POSTCONDITION,
        DANGLING_INVARIANT,
        STRUCTURAL_ERROR
    }

    private final Severity severity;
    private final Code code;
    private final String message;
    private final SourceSpan span;

    public Diagnostic(Severity severity, Code code, String message, SourceSpan span) {
        this.severity = Objects.requireNonNull(severity);
        this.code = Objects.requireNonNull(code);
        this.message = Objects.requireNonNull(message);
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    public Severity getSeverity() {
        return severity;
    }

    public Code getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String toString() {
        return severity + " " + code + " at " + span + ": " + message;
    }
}
