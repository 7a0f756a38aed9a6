package com.dimosr.exporter.exceptions;

/**
 * An exception denoting that a call to a remote repository (instance listing, metric listing, sample fetching) failed
 */
public class RepositoryException extends RuntimeException {
    public RepositoryException(final String message) {
        super(message);
    }

    public RepositoryException(final String message, final Throwable e) {
        super(message, e);
    }
}
