package com.wiregen.api;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers the service against the interfaces it implements, including inherited ones.
 *
 * @see SkipRegistration
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface RegisterAsAll {

    RegistrationMode value() default RegistrationMode.ALL;

    /**
     * Instance sharing across the registered contracts. When left out, {@link RegistrationMode#EXCLUSIONARY}
     * plans {@link InstanceSharing#SHARED} and the other modes {@link InstanceSharing#SEPARATE}.
     * Singletons always share.
     */
    InstanceSharing instanceSharing() default InstanceSharing.SEPARATE;
}
