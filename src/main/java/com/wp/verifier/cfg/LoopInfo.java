package com.wp.verifier.cfg;

import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.SourceSpan;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * One loop of a function: its header, guard, invariant and the blocks of its body.
 */
public final class LoopInfo {

    private final int header;
    private final int bodyEntry;
    private final int exitTarget;
    private final Expr guard;
    private final Annotation invariant;
    private final Set<Integer> bodyBlocks;
    private final SourceSpan span;

    LoopInfo(int header, int bodyEntry, int exitTarget, Expr guard, Annotation invariant,
             Set<Integer> bodyBlocks, SourceSpan span) {
        this.header = header;
        this.bodyEntry = bodyEntry;
        this.exitTarget = exitTarget;
        this.guard = guard;
        this.invariant = invariant;
        this.bodyBlocks = Collections.unmodifiableSet(new TreeSet<>(bodyBlocks));
        this.span = span;
    }

    public int getHeader() {
        return header;
    }

    /** Target of the header's true edge. */
    public int getBodyEntry() {
        return bodyEntry;
    }

    /** Target of the header's false edge. */
    public int getExitTarget() {
        return exitTarget;
    }

    public Expr getGuard() {
        return guard;
    }

    public Annotation getInvariant() {
        return invariant;
    }

    /**
     * Blocks executed as part of an iteration, including those of nested loops. Excludes the header.
     */
    public Set<Integer> getBodyBlocks() {
        return bodyBlocks;
    }

    public boolean containsBlock(int block) {
        return bodyBlocks.contains(block);
    }

    public SourceSpan getSpan() {
        return span;
    }
}
