package com.dimosr.exporter;

import com.dimosr.exporter.exceptions.ProductHandlerNotFoundException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The handler factories of all the namespaces the exporter can collect
 */
public class ProductHandlerRegistry {
    private final Map<String, ProductHandlerFactory> factories = new ConcurrentHashMap<>();

    /**
     * @return a registry where each of the given namespaces is handled by a {@link DefaultProductHandler}
     */
    public static ProductHandlerRegistry withDefaults(final String... namespaces) {
        ProductHandlerRegistry registry = new ProductHandlerRegistry();
        for (String namespace : namespaces) {
            registry.register(namespace, DefaultProductHandler::new);
        }
        return registry;
    }

    public ProductHandlerRegistry register(final String namespace, final ProductHandlerFactory factory) {
        factories.put(namespace, factory);
        return this;
    }

    /**
     * @throws ProductHandlerNotFoundException if no factory is registered for the namespace
     */
    public ProductHandlerFactory getFactory(final String namespace) {
        ProductHandlerFactory factory = factories.get(namespace);
        if (factory == null) {
            throw new ProductHandlerNotFoundException(namespace);
        }
        return factory;
    }
}
