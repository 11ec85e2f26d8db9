package com.example.imagestore.service;

import com.example.imagestore.exception.RemoteFetchException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;

@Component
public class RestClientImageFetcher implements RemoteImageFetcher {

    private final RestClient http;

    public RestClientImageFetcher(@Qualifier("imageFetchRestClient") RestClient http) {
        this.http = http;
    }

    @Override
    public byte[] fetch(String url) {
        byte[] body;
        try {
            body = http.get()
                .uri(URI.create(url))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw new RemoteFetchException("HTTP " + res.getStatusCode().value() + " from " + url);
                })
                .body(byte[].class);
        } catch (RestClientException | IllegalArgumentException ex) {
            throw new RemoteFetchException("Failed to fetch " + url, ex);
        }
        if (body == null || body.length == 0) {
            throw new RemoteFetchException("Empty response from " + url);
        }
        return body;
    }
}
