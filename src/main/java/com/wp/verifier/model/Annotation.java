package com.wp.verifier.model;

import java.util.Objects;

/**
 * A predicate attached to a program point: function entry, function exit or a loop header.
 */
public final class Annotation {

    public enum Kind {
        PRECONDITION,
        POSTCONDITION,
        INVARIANT
    }

    private final Kind kind;
    private final Expr predicate;
    private final SourceSpan span;
    private final boolean implicit;

    public Annotation(Kind kind, Expr predicate, SourceSpan span) {
        this(kind, predicate, span, false);
    }

    private Annotation(Kind kind, Expr predicate, SourceSpan span, boolean implicit) {
        this.kind = Objects.requireNonNull(kind);
        this.predicate = Objects.requireNonNull(predicate);
        this.span = span != null ? span : SourceSpan.UNKNOWN;
        this.implicit = implicit;
    }

    /**
     * The {@code true} annotation used in place of one the source did not declare.
     */
    public static Annotation implicitTrue(Kind kind, SourceSpan span) {
        return new Annotation(kind, Expr.TRUE, span, true);
    }

    public Kind getKind() {
        return kind;
    }

    public Expr getPredicate() {
        return predicate;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public String toString() {
        return kind + (implicit ? " (implicit) " : " ") + predicate;
    }
}
