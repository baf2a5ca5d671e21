package com.wp.verifier.annotations;

import java.lang.annotation.*;

/**
 * Postcondition of a verified method.
 * May refer to {@code result} and to pre-state values through {@code old(..)}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Repeatable(Ensures.List.class)
public @interface Ensures {
    /**
     * The postcondition expression.
     * @return The postcondition
     */
    String value();

    /**
     * Container annotation for multiple @Ensures.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.METHOD)
    @interface List {
        Ensures[] value();
    }
}
