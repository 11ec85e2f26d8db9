package com.example.imagestore.exception;

public class StorageWriteException extends ImageStoreException {

    public StorageWriteException(String message) {
        super(message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getError() {
        return "path_not_writable";
    }
}
