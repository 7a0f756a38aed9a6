package com.dimosr.exporter;

import com.dimosr.exporter.config.ProductConfig;
import com.dimosr.exporter.core.InstanceRepository;
import com.dimosr.exporter.core.ProductHandler;

import java.util.Optional;

/**
 * Creates the handler of a namespace
 */
@FunctionalInterface
public interface ProductHandlerFactory {
    /**
     * @param instanceRepository the repository listing the instances of the namespace,
     *                           empty for products that do not support instance discovery
     */
    ProductHandler create(String namespace, ProductConfig productConfig, Optional<InstanceRepository> instanceRepository);
}
