package com.example.imagestore.exception;

/**
 * Storage backend failure other than a missing object.
 */
public class ImageStorageException extends ImageStoreException {

    public ImageStorageException(String message) {
        super(message);
    }

    public ImageStorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return "storage_error";
    }
}
