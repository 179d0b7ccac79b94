package com.wiregen.api.container;

import java.util.function.Function;

/**
 * Registration surface that generated code writes to.
 *
 * <p>Container integrations implement this interface; WireGen does not ship a container.
 */
public interface ServiceCollection {

    /**
     * Registers {@code implementationType} as the provider of {@code serviceType}.
     *
     * @param lifetime instance lifetime
     * @param serviceType type the service is resolved by
     * @param implementationType type that is constructed
     * @param <T> service type
     * @return this collection
     */
    <T> ServiceCollection add(ServiceLifetime lifetime, Class<T> serviceType, Class<? extends T> implementationType);

    /**
     * Registers a factory for {@code serviceType}. Generated code uses this to forward an
     * interface to the registration of the implementation type.
     *
     * @param lifetime instance lifetime
     * @param serviceType type the service is resolved by
     * @param factory creates the instance from the provider
     * @param <T> service type
     * @return this collection
     */
    <T> ServiceCollection addFactory(ServiceLifetime lifetime, Class<T> serviceType,
                                     Function<ServiceProvider, ? extends T> factory);
}
