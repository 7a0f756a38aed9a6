package com.dimosr.exporter.exceptions;

/**
 * An exception denoting that there is no product configuration for a namespace
 */
public class ProductConfigNotFoundException extends RuntimeException {
    public ProductConfigNotFoundException(final String namespace) {
        super(String.format("Product configuration not found, namespace=%s", namespace));
    }
}
