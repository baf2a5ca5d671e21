package com.wp.verifier.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pre- and postconditions of a callable, used to summarise calls modularly.
 * Postconditions may mention {@link Expr#RESULT} and {@code old(..)} of the parameters.
 */
public class MethodContract {

    /**
     * Where the contract came from.
     */
    public enum Origin {
        DECLARED, EXTERNAL
    }

    private final String owner;
    private final String name;
    private final List<Parameter> parameters;
    private final Type returnType;
    private final Origin origin;
    private final List<Expr> preconditions = new ArrayList<>();
    private final List<Expr> postconditions = new ArrayList<>();

    public MethodContract(String name, List<Parameter> parameters, Type returnType, Origin origin) {
        this(null, name, parameters, returnType, origin);
    }

    /**
     * @param owner the declaring type, or {@code null} for a contract that applies to any caller
     */
    public MethodContract(String owner, String name, List<Parameter> parameters, Type returnType, Origin origin) {
        this.owner = owner;
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.returnType = returnType;
        this.origin = origin;
    }

    public void addPrecondition(Expr precondition) {
        if (!preconditions.contains(precondition)) {
            preconditions.add(precondition);
        }
    }

    public void addPostcondition(Expr postcondition) {
        if (!postconditions.contains(postcondition)) {
            postconditions.add(postcondition);
        }
    }

    public String getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public int getArity() {
        return parameters.size();
    }

    /**
     * @return the return type, or {@code null} for a method without a result
     */
    public Type getReturnType() {
        return returnType;
    }

    public Origin getOrigin() {
        return origin;
    }

    public List<Expr> getPreconditions() {
        return Collections.unmodifiableList(preconditions);
    }

    public List<Expr> getPostconditions() {
        return Collections.unmodifiableList(postconditions);
    }

    public boolean isEmpty() {
        return preconditions.isEmpty() && postconditions.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(owner == null ? name : owner + "." + name).append(parameters);
        for (Expr pre : preconditions) {
            sb.append("\n  requires ").append(pre);
        }
        for (Expr post : postconditions) {
            sb.append("\n  ensures ").append(post);
        }
        return sb.toString();
    }
}
