package com.example.imagestore.config;

import com.example.imagestore.storage.StorageBackend;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    private StorageBackend type = StorageBackend.LOCAL;
    private String url;
    private String localRoot = "storage/public";
    private String localSecureRoot = "storage/secure";
    private String endpoint = "https://s3.amazonaws.com";
    private String accessKey;
    private String secretKey;
    private String bucket = "image-store";
    private String region = "us-east-1";

    public StorageBackend getType() {
        return type;
    }

    public void setType(StorageBackend type) {
        this.type = type;
    }

    /**
     * Public base URL override for stored images. Empty means "derive it from the backend".
     */
    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getLocalRoot() {
        return localRoot;
    }

    public void setLocalRoot(String localRoot) {
        this.localRoot = localRoot;
    }

    public String getLocalSecureRoot() {
        return localSecureRoot;
    }

    public void setLocalSecureRoot(String localSecureRoot) {
        this.localSecureRoot = localSecureRoot;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public void setAccessKey(String accessKey) {
        this.accessKey = accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }
}
