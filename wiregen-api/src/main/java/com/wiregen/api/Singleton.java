package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a service that is created once per container.
 *
 * <p>A singleton must not depend on {@link Scoped} or {@link Transient} services; WireGen
 * reports such edges as lifetime violations.
 *
 * @see Scoped
 * @see Transient
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface Singleton {
}
