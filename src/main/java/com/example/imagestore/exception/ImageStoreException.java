package com.example.imagestore.exception;

/**
 * Base type for failures surfaced by the image services. {@link #getError()} is a stable code
 * the HTTP layer puts in its error body.
 */
public abstract class ImageStoreException extends RuntimeException {

    protected ImageStoreException(String message) {
        super(message);
    }

    protected ImageStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getError();
}
