package com.wiregen.api.container;

/**
 * Resolves services from a container.
 */
public interface ServiceProvider {

    /**
     * Returns the service registered for the given type.
     *
     * @param serviceType the registered type
     * @param <T> service type
     * @return the service instance
     * @throws IllegalStateException if no service is registered for the type
     */
    <T> T getRequiredService(Class<T> serviceType);
}
