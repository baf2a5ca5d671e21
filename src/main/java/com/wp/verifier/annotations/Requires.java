package com.wp.verifier.annotations;

import java.lang.annotation.*;

/**
 * Precondition of a verified method.
 * The predicate is assumed on entry and checked at every call site.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Requires.List.class)
public @interface Requires {
    /**
     * The precondition, written as a Java boolean expression.
     * @return The precondition
     */
    String value();

    /**
     * Container annotation for multiple @Requires.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Requires[] value();
    }
}
