package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares one or more dependencies on the type itself. WireGen generates a private final
 * field and a constructor parameter for every listed type.
 *
 * <p>Field names are derived from the dependency's type name: with the defaults,
 * {@code IOrderRepository} becomes {@code _orderRepository}. Every occurrence of the annotation
 * carries its own naming settings.
 *
 * <pre>{@code
 * @Singleton
 * @DependsOn({IClock.class, PriceCatalog.class})
 * @DependsOn(types = "java.util.List<IPricingRule>", namingConvention = NamingConvention.SNAKE_CASE)
 * public class PricingService implements IPricingService {
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
@Repeatable(DependsOn.List.class)
public @interface DependsOn {

    /**
     * Dependency types.
     */
    Class<?>[] value() default {};

    /**
     * Dependency types given as source text, for parameterized types such as
     * {@code "List<IHandler>"} that cannot be written as class literals.
     */
    String[] types() default {};

    NamingConvention namingConvention() default NamingConvention.CAMEL_CASE;

    /**
     * Strips a leading interface marker ({@code I} followed by an upper case letter).
     */
    boolean stripI() default true;

    String prefix() default "_";

    /**
     * Suppresses diagnostics for these dependencies.
     */
    boolean external() default false;

    /**
     * Container for repeated {@link DependsOn} annotations.
     */
    @Documented
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.TYPE)
    @interface List {
        DependsOn[] value();
    }
}
