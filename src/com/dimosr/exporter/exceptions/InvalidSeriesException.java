package com.dimosr.exporter.exceptions;

public class InvalidSeriesException extends RuntimeException {
    public InvalidSeriesException(final String message) {
        super(message);
    }
}
