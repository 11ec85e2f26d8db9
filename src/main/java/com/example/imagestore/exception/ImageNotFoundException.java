package com.example.imagestore.exception;

public class ImageNotFoundException extends ImageStoreException {

    public ImageNotFoundException(String message) {
        super(message);
    }

    public ImageNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return "not_found";
    }
}
