package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a field to a configuration value.
 *
 * <p>The generated constructor receives a {@link com.wiregen.api.container.Configuration} and
 * assigns the converted value. Supported field types are {@code String}, {@code int},
 * {@code long}, {@code boolean}, {@code double} and their wrappers. The field must not have an
 * initializer.
 *
 * <pre>{@code
 * @Singleton
 * public class MailSender {
 *     @InjectConfiguration("mail.host")
 *     private final String host;
 *
 *     @InjectConfiguration(value = "mail.port", defaultValue = "25")
 *     private final int port;
 * }
 * }</pre>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.FIELD)
public @interface InjectConfiguration {

    /**
     * Configuration key.
     */
    String value();

    /**
     * Value used when the key is missing. Declaring it makes the key optional.
     */
    String defaultValue() default "";

    /**
     * When {@code true} and no default is declared, a missing key fails construction. Otherwise
     * the field keeps {@code null}, zero or {@code false}.
     */
    boolean required() default true;
}
