package com.wp.verifier.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks methods or classes the verifier should not look at.
 *
 * On a class, every method declared in it is skipped, nested classes included.
 *
 * <pre>
 * {@code
 * @SkipVerification(reason = "uses strings")
 * public String describe() { ... }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface SkipVerification {

    /**
     * @return why the element is skipped, or an empty string
     */
    String reason() default "";
}
