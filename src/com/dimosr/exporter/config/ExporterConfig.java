package com.dimosr.exporter.config;

import com.dimosr.exporter.exceptions.ProductConfigNotFoundException;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The configuration of all the products collected by the exporter
 */
public final class ExporterConfig {
    private final ImmutableMap<String, ProductConfig> products;

    private ExporterConfig(final Map<String, ProductConfig> products) {
        this.products = ImmutableMap.copyOf(products);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws ProductConfigNotFoundException if the namespace has not been configured
     */
    public ProductConfig getProductConfig(final String namespace) {
        ProductConfig productConfig = products.get(namespace);
        if (productConfig == null) {
            throw new ProductConfigNotFoundException(namespace);
        }
        return productConfig;
    }

    public ImmutableMap<String, ProductConfig> getProducts() {
        return products;
    }

    public static class Builder {
        private final Map<String, ProductConfig> products = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder withProduct(final ProductConfig productConfig) {
            products.put(productConfig.getNamespace(), productConfig);
            return this;
        }

        public ExporterConfig build() {
            return new ExporterConfig(products);
        }
    }
}
