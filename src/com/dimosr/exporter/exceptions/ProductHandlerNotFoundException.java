package com.dimosr.exporter.exceptions;

/**
 * An exception denoting that no product handler is registered for a namespace
 */
public class ProductHandlerNotFoundException extends RuntimeException {
    public ProductHandlerNotFoundException(final String namespace) {
        super(String.format("Product handler not found, namespace=%s", namespace));
    }
}
