package com.wp.verifier.visitor;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.wp.verifier.annotations.Ensures;
import com.wp.verifier.annotations.Requires;
import com.wp.verifier.annotations.SkipVerification;
import com.wp.verifier.ast.FunctionDecl;
import com.wp.verifier.ast.Stmt;
import com.wp.verifier.model.Annotation;
import com.wp.verifier.model.Diagnostic;
import com.wp.verifier.model.Expr;
import com.wp.verifier.model.Parameter;
import com.wp.verifier.model.SourceSpan;
import com.wp.verifier.model.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST visitor that turns every method with a body into a {@link FunctionDecl}.
 * Contracts come from {@link Requires} and {@link Ensures} annotations and from contract
 * calls in the body. Methods and classes marked {@link SkipVerification} are left out.
 */
public class FunctionExtractionVisitor extends VoidVisitorAdapter<Void> {

    private static final Logger logger = LoggerFactory.getLogger(FunctionExtractionVisitor.class);

    private final String origin;
    private final List<FunctionDecl> functions = new ArrayList<>();
    private int skipped = 0;

    public FunctionExtractionVisitor(String origin) {
        this.origin = origin;
    }

    public List<FunctionDecl> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * Number of methods left out because of {@link SkipVerification}.
     */
    public int getSkippedCount() {
        return skipped;
    }

    @Override
    public void visit(ClassOrInterfaceDeclaration classDecl, Void arg) {
        if (findAnnotation(classDecl.getAnnotations(), SkipVerification.class.getSimpleName()) != null) {
            logger.debug("Skipping class {}", classDecl.getNameAsString());
            skipped += classDecl.findAll(MethodDeclaration.class).size();
            return;
        }
        super.visit(classDecl, arg);
    }

    @Override
    public void visit(MethodDeclaration methodDecl, Void arg) {
        if (shouldProcessMethod(methodDecl)) {
            try {
                functions.add(extract(methodDecl));
            } catch (RuntimeException e) {
                logger.error("Error extracting method {} in {}", methodDecl.getNameAsString(), origin, e);
            }
        }
        super.visit(methodDecl, arg);
    }

    private boolean shouldProcessMethod(MethodDeclaration methodDecl) {
        if (methodDecl.getBody().isEmpty()) {
            return false;
        }
        if (findAnnotation(methodDecl.getAnnotations(), SkipVerification.class.getSimpleName()) != null) {
            logger.debug("Method {} is marked to be skipped", methodDecl.getNameAsString());
            skipped++;
            return false;
        }
        return true;
    }

    FunctionDecl extract(MethodDeclaration methodDecl) {
        String name = methodDecl.getNameAsString();
        SourceSpan span = StatementLowering.span(methodDecl, origin);
        List<Stmt> problems = new ArrayList<>();

        ExpressionLowering expressions = new ExpressionLowering();
        List<Parameter> parameters = new ArrayList<>();
        for (com.github.javaparser.ast.body.Parameter parameter : methodDecl.getParameters()) {
            Type type = ExpressionLowering.modelType(parameter.getType());
            if (type == null) {
                problems.add(new Stmt.Unsupported("parameter '" + parameter.getNameAsString() + "' of type "
                        + parameter.getTypeAsString(), StatementLowering.span(parameter, origin)));
                type = Type.INT;
            }
            parameters.add(new Parameter(parameter.getNameAsString(), type));
            expressions.declare(parameter.getNameAsString(), type);
        }

        Type returnType = null;
        if (!methodDecl.getType().isVoidType()) {
            returnType = ExpressionLowering.modelType(methodDecl.getType());
            if (returnType == null) {
                problems.add(new Stmt.Unsupported("return type " + methodDecl.getTypeAsString(), span));
                returnType = Type.INT;
            }
            expressions.declare(Expr.RESULT, returnType);
        }

        List<Annotation> preconditions = new ArrayList<>();
        List<Annotation> postconditions = new ArrayList<>();
        for (AnnotationExpr annotation : methodDecl.getAnnotations()) {
            String annotationName = annotation.getName().getIdentifier();
            SourceSpan annotationSpan = StatementLowering.span(annotation, origin);
            if (annotationName.equals(Requires.class.getSimpleName())) {
                preconditions.add(new Annotation(Annotation.Kind.PRECONDITION,
                        expressions.parsePredicate(annotationValue(annotation)), annotationSpan));
            } else if (annotationName.equals(Ensures.class.getSimpleName())) {
                postconditions.add(new Annotation(Annotation.Kind.POSTCONDITION,
                        expressions.parsePredicate(annotationValue(annotation)), annotationSpan));
            }
        }

        BlockStmt bodyStmt = methodDecl.getBody().get();
        StatementLowering statements = new StatementLowering(expressions, origin, returnType);
        List<Stmt> body = new ArrayList<>(problems);
        body.addAll(statements.lowerBody(bodyStmt));
        preconditions.addAll(statements.getPreconditions());
        postconditions.addAll(statements.getPostconditions());
        List<Diagnostic> diagnostics = statements.getDiagnostics();

        logger.debug("Extracted {} with {} precondition(s) and {} postcondition(s)",
                name, preconditions.size(), postconditions.size());
        return new FunctionDecl(ownerOf(methodDecl), name, parameters, returnType, preconditions,
                combine(postconditions), body, span, diagnostics);
    }

    /**
     * Fully qualified name of the innermost type enclosing a method, or {@code null} if there is none.
     */
    static String ownerOf(MethodDeclaration methodDecl) {
        Node node = methodDecl.getParentNode().orElse(null);
        while (node != null && !(node instanceof TypeDeclaration)) {
            node = node.getParentNode().orElse(null);
        }
        if (node == null) {
            return null;
        }
        TypeDeclaration<?> type = (TypeDeclaration<?>) node;
        return type.getFullyQualifiedName().orElse(type.getNameAsString());
    }

    private static Annotation combine(List<Annotation> postconditions) {
        if (postconditions.isEmpty()) {
            return null;
        }
        if (postconditions.size() == 1) {
            return postconditions.get(0);
        }
        List<Expr> predicates = new ArrayList<>();
        for (Annotation postcondition : postconditions) {
            predicates.add(postcondition.getPredicate());
        }
        return new Annotation(Annotation.Kind.POSTCONDITION, Expr.and(predicates), postconditions.get(0).getSpan());
    }

    private static AnnotationExpr findAnnotation(List<AnnotationExpr> annotations, String simpleName) {
        for (AnnotationExpr annotation : annotations) {
            if (annotation.getName().getIdentifier().equals(simpleName)) {
                return annotation;
            }
        }
        return null;
    }

    /**
     * Gets the {@code value} of a single-member or normal annotation.
     */
    private static String annotationValue(AnnotationExpr annotation) {
        Expression value = null;
        if (annotation.isSingleMemberAnnotationExpr()) {
            value = annotation.asSingleMemberAnnotationExpr().getMemberValue();
        } else if (annotation.isNormalAnnotationExpr()) {
            for (MemberValuePair pair : annotation.asNormalAnnotationExpr().getPairs()) {
                if (pair.getNameAsString().equals("value")) {
                    value = pair.getValue();
                }
            }
        }
        if (value instanceof StringLiteralExpr) {
            return ((StringLiteralExpr) value).asString();
        }
        return value != null ? value.toString() : "true";
    }
}
