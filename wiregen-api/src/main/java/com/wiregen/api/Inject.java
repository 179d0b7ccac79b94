package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a single dependency through a field.
 *
 * <p>The field keeps its own name; the generated constructor receives a parameter for it and
 * assigns it. The field must not have an initializer.
 *
 * <pre>{@code
 * @Scoped
 * public class OrderService {
 *     @Inject
 *     private OrderRepository repository;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.FIELD)
public @interface Inject {

    /**
     * When {@code true} the dependency is provided outside the analysed sources and no
     * diagnostics are reported for it.
     */
    boolean external() default false;
}
