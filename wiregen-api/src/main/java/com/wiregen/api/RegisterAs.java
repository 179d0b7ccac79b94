package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers the service as itself plus exactly the listed interfaces.
 *
 * <p>Every listed type must be an interface the service implements.
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface RegisterAs {

    Class<?>[] value();

    InstanceSharing instanceSharing() default InstanceSharing.SEPARATE;
}
