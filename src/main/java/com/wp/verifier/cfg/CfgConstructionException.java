package com.wp.verifier.cfg;

import com.wp.verifier.model.SourceSpan;

/**
 * Thrown when a function body has a shape the CFG builder cannot represent. Scoped to one function.
 */
public class CfgConstructionException extends Exception {

    private final SourceSpan span;

    public CfgConstructionException(String message, SourceSpan span) {
        super(message);
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    public SourceSpan getSpan() {
        return span;
    }
}
