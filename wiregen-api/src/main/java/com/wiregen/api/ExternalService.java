package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type that is registered by hand or by another library.
 *
 * <p>The type is left out of dependency validation and registration entirely, both as a
 * dependent and as a dependency. It still gets a generated constructor when it declares
 * dependencies.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface ExternalService {
}
