package com.example.imagestore.exception;

public class RemoteFetchException extends ImageStoreException {

    public RemoteFetchException(String message) {
        super(message);
    }

    public RemoteFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return "cannot_fetch_image";
    }
}
