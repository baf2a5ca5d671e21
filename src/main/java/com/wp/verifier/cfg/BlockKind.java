package com.wp.verifier.cfg;

public enum BlockKind {
    NORMAL,
    LOOP_HEADER,
    NORMAL_EXIT,
    ABORT_EXIT;

    public boolean isExit() {
        return this == NORMAL_EXIT || this == ABORT_EXIT;
    }
}
