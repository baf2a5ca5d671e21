package com.wp.verifier.model;

import java.util.Objects;

/**
 * A formula whose validity establishes one proof obligation of a function, plus the
 * provenance needed to report it.
 */
public final class VerificationCondition {

    private final String id;
    private final String functionName;
    private final Expr formula;
    private final ConditionKind kind;
    private final SourceSpan span;
    private final String description;
    private final boolean assumesImplicitInvariant;

    public VerificationCondition(String id, String functionName, Expr formula, ConditionKind kind,
                                 SourceSpan span, String description, boolean assumesImplicitInvariant) {
        this.id = Objects.requireNonNull(id);
        this.functionName = Objects.requireNonNull(functionName);
        this.formula = Objects.requireNonNull(formula);
        this.kind = Objects.requireNonNull(kind);
        this.span = span != null ? span : SourceSpan.UNKNOWN;
        this.description = description != null ? description : kind.getDescription();
        this.assumesImplicitInvariant = assumesImplicitInvariant;
    }

    public String getId() {
        return id;
    }

    public String getFunctionName() {
        return functionName;
    }

    public Expr getFormula() {
        return formula;
    }

    public ConditionKind getKind() {
        return kind;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Human-readable statement of the condition, e.g. {@code postcondition `y > 0`}.
     */
    public String getDescription() {
        return description;
    }

    /**
     * Whether the hypothesis of this condition contains a loop invariant the source never declared.
     */
    public boolean assumesImplicitInvariant() {
        return assumesImplicitInvariant;
    }

    @Override
    public String toString() {
        return id + " [" + kind + "] " + formula;
    }
}
