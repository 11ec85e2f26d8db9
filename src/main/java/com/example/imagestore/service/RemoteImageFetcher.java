package com.example.imagestore.service;

public interface RemoteImageFetcher {

    /**
     * @throws com.example.imagestore.exception.RemoteFetchException on network errors and non-2xx responses
     */
    byte[] fetch(String url);
}
