package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Excludes interfaces from the registrations produced by {@link RegisterAsAll}.
 * Skipping an interface the service does not implement is reported as an error.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
@Repeatable(SkipRegistration.List.class)
public @interface SkipRegistration {

    Class<?>[] value();

    @Documented
    @Retention(RetentionPolicy.SOURCE)
    @Target(ElementType.TYPE)
    @interface List {
        SkipRegistration[] value();
    }
}
