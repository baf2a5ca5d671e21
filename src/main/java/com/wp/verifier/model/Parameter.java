package com.wp.verifier.model;

import java.util.Objects;

/**
 * A typed formal parameter of a function or external method.
 */
public final class Parameter {

    private final String name;
    private final Type type;

    public Parameter(String name, Type type) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public Expr.Variable asVariable() {
        return Expr.var(name, type);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Parameter)) return false;
        Parameter that = (Parameter) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ": " + type;
    }
}
