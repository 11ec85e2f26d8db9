package com.example.imagestore.exception;

/**
 * The codec could not decode the source bytes.
 */
public class ThumbnailCreationException extends ImageStoreException {

    public ThumbnailCreationException(String message) {
        super(message);
    }

    public ThumbnailCreationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return "cannot_create_thumbs";
    }
}
