package com.example.imagestore.storage;

public enum StorageBackend {
    LOCAL,
    LOCAL_SECURE,
    S3
}
