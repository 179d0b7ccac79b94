package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers the service only when the runtime environment or a configuration value matches.
 *
 * <p>Environment and configuration clauses are combined with AND. Several conditional
 * implementations of the same interface whose conditions exclude each other are registered
 * through an if/else-if chain, so the first matching one wins.
 *
 * <p>Repeating the annotation declares alternatives: the service is registered when any of
 * them holds.
 *
 * <pre>{@code
 * @ConditionalService(environment = "Development")
 * public class ConsoleEmailSender implements IEmailSender { }
 *
 * @ConditionalService(configKey = "email.provider", equalsValue = "smtp")
 * public class SmtpEmailSender implements IEmailSender { }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
@Repeatable(ConditionalService.List.class)
public @interface ConditionalService {

    /**
     * Comma separated environments in which the service is registered.
     */
    String environment() default "";

    /**
     * Comma separated environments in which the service is not registered.
     */
    String notEnvironment() default "";

    String configKey() default "";

    String equalsValue() default "";

    /**
     * Comma separated values; a missing configuration value compares as the empty string.
     */
    String notEquals() default "";

    /**
     * Container for repeated {@link ConditionalService} annotations.
     */
    @Documented
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.TYPE)
    @interface List {
        ConditionalService[] value();
    }
}
