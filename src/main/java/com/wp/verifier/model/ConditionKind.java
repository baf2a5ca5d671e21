package com.wp.verifier.model;

/**
 * The kind of proof obligation a verification condition discharges.
 */
public enum ConditionKind {
    POSTCONDITION("postcondition"),
    LOOP_INITIATION("loop invariant on entry"),
    LOOP_PRESERVATION("loop invariant preserved by the body"),
    LOOP_USE("loop exit establishes what follows"),
    ASSERTION("assertion"),
    CALL_PRECONDITION("precondition of call"),
    PANIC_FREEDOM("panic is unreachable");

    private final String description;

    ConditionKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
