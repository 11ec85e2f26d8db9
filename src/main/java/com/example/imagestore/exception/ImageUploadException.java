package com.example.imagestore.exception;

/**
 * Malformed upload input, rejected before anything is stored.
 */
public class ImageUploadException extends ImageStoreException {

    public ImageUploadException(String message) {
        super(message);
    }

    public ImageUploadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return "invalid_upload";
    }
}
