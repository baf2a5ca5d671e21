package com.wp.verifier.ast;

import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.Parameter;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A typed function as handed to the verifier: signature, contract and body.
 */
public final class FunctionDecl {

    private final String owner;
    private final String name;
    private final List<Parameter> parameters;
    private final Type returnType;
    private final List<Annotation> preconditions;
    private final Annotation postcondition;
    private final List<Stmt> body;
    private final SourceSpan span;
    private final List<Diagnostic> diagnostics;

    public FunctionDecl(String name, List<Parameter> parameters, Type returnType,
                        List<Annotation> preconditions, Annotation postcondition,
                        List<Stmt> body, SourceSpan span) {
        this(name, parameters, returnType, preconditions, postcondition, body, span, Collections.emptyList());
    }

    /**
     * @param diagnostics problems the front end found while producing this function, carried into its report
     */
    public FunctionDecl(String name, List<Parameter> parameters, Type returnType,
                        List<Annotation> preconditions, Annotation postcondition,
                        List<Stmt> body, SourceSpan span, List<Diagnostic> diagnostics) {
        this(null, name, parameters, returnType, preconditions, postcondition, body, span, diagnostics);
    }

    /**
     * @param owner fully qualified name of the declaring type, or {@code null} for a free-standing function
     */
    public FunctionDecl(String owner, String name, List<Parameter> parameters, Type returnType,
                        List<Annotation> preconditions, Annotation postcondition,
                        List<Stmt> body, SourceSpan span, List<Diagnostic> diagnostics) {
        this.owner = owner;
        this.name = Objects.requireNonNull(name);
        this.parameters = List.copyOf(parameters);
        this.returnType = returnType;
        this.preconditions = List.copyOf(preconditions);
        this.postcondition = postcondition;
        this.body = List.copyOf(body);
        this.span = span != null ? span : SourceSpan.UNKNOWN;
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return the declaring type, or {@code null} if the function has none
     */
    public String getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    /**
     * Name used in reports, e.g. {@code com.acme.Calc.inc}; the bare name when there is no owner.
     */
    public String getQualifiedName() {
        return owner == null ? name : owner + "." + name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    /**
     * @return the return type, or {@code null} for a function returning nothing
     */
    public Type getReturnType() {
        return returnType;
    }

    public List<Annotation> getPreconditions() {
        return preconditions;
    }

    /**
     * @return the declared postcondition, or {@code null} if the function has none
     */
    public Annotation getPostcondition() {
        return postcondition;
    }

    public List<Stmt> getBody() {
        return body;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Signature used in logs and reports, e.g. {@code sum(n: INT)}.
     */
    public String getSignature() {
        List<String> params = new ArrayList<>();
        for (Parameter p : parameters) {
            params.add(p.toString());
        }
        return name + "(" + String.join(", ", params) + ")";
    }

    @Override
    public String toString() {
        return getSignature();
    }
}
