package com.wp.verifier.cfg;

import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.SourceSpan;

import java.util.List;
import java.util.Objects;

/**
 * Straight-line sequence of instructions with no internal branching.
 */
public final class BasicBlock {

    private final int id;
    private final BlockKind kind;
    private final List<Instruction> instructions;
    private final List<Edge> outgoing;
    private final Annotation invariant;
    private final SourceSpan span;

    BasicBlock(int id, BlockKind kind, List<Instruction> instructions, List<Edge> outgoing,
               Annotation invariant, SourceSpan span) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind);
        this.instructions = List.copyOf(instructions);
        this.outgoing = List.copyOf(outgoing);
        this.invariant = invariant;
        this.span = span != null ? span : SourceSpan.UNKNOWN;
    }

    public int getId() {
        return id;
    }

    public BlockKind getKind() {
        return kind;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public List<Edge> getOutgoing() {
        return outgoing;
    }

    /**
     * @return the loop invariant if this is a loop header, otherwise {@code null}
     */
    public Annotation getInvariant() {
        return invariant;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public boolean isLoopHeader() {
        return kind == BlockKind.LOOP_HEADER;
    }

    @Override
    public String toString() {
        return "bb" + id + " (" + kind + ", " + instructions.size() + " instructions)";
    }
}
