package com.wp.verifier.cfg;

public enum EdgeKind {
    FALLTHROUGH,
    CONDITIONAL_TRUE,
    CONDITIONAL_FALSE,
    LOOP_BACK,
    /** return or panic */
    EARLY_EXIT
}
