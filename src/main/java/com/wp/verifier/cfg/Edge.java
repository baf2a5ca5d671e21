package com.wp.verifier.cfg;

import com.wp.verifier.model.Expr;
import com.wp.verifier.model.SourceSpan;

import java.util.Objects;

/**
 * Directed edge between two blocks, referenced by their index in the block table.
 */
public final class Edge {

    private final int source;
    private final int target;
    private final EdgeKind kind;
    private final Expr guard;
    private final SourceSpan span;
    private final String label;

    public Edge(int source, int target, EdgeKind kind, Expr guard, SourceSpan span, String label) {
        this.source = source;
        this.target = target;
        this.kind = Objects.requireNonNull(kind);
        this.guard = guard;
        this.span = span != null ? span : SourceSpan.UNKNOWN;
        this.label = label;
    }

    public int getSource() {
        return source;
    }

    public int getTarget() {
        return target;
    }

    public EdgeKind getKind() {
        return kind;
    }

    /**
     * @return the condition under which this edge is taken, or {@code null} if unconditional
     */
    public Expr getGuard() {
        return guard;
    }

    public Expr getGuardOrTrue() {
        return guard != null ? guard : Expr.TRUE;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * @return panic message on edges into the abort exit, otherwise {@code null}
     */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "bb" + source + " -> bb" + target + " [" + kind + (guard != null ? ", " + guard : "") + "]";
    }
}
