package com.example.imagestore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.images")
public class ImageProperties {

    private String baseUrl = "http://localhost:8080";
    private boolean secureUploads = false;
    private Duration thumbnailCacheTtl = Duration.ofHours(72);
    private long thumbnailCacheMaxSize = 100_000;
    private int sweepBatchSize = 1000;
    private String avatarUrl;
    private boolean disableServices = false;
    private Duration fetchConnectTimeout = Duration.ofSeconds(5);
    private Duration fetchReadTimeout = Duration.ofSeconds(10);

    /**
     * Base URL of this application, used for local disks and to recognise our own image links.
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * When set, new image paths get a random token in front of the file name.
     */
    public boolean isSecureUploads() {
        return secureUploads;
    }

    public void setSecureUploads(boolean secureUploads) {
        this.secureUploads = secureUploads;
    }

    public Duration getThumbnailCacheTtl() {
        return thumbnailCacheTtl;
    }

    public void setThumbnailCacheTtl(Duration thumbnailCacheTtl) {
        this.thumbnailCacheTtl = thumbnailCacheTtl;
    }

    public long getThumbnailCacheMaxSize() {
        return thumbnailCacheMaxSize;
    }

    public void setThumbnailCacheMaxSize(long thumbnailCacheMaxSize) {
        this.thumbnailCacheMaxSize = thumbnailCacheMaxSize;
    }

    public int getSweepBatchSize() {
        return sweepBatchSize;
    }

    public void setSweepBatchSize(int sweepBatchSize) {
        this.sweepBatchSize = sweepBatchSize;
    }

    /**
     * Avatar source template. Supports the {@code ${hash}}, {@code ${size}} and {@code ${email}} placeholders.
     */
    public String getAvatarUrl() {
        return avatarUrl;
    }

    public void setAvatarUrl(String avatarUrl) {
        this.avatarUrl = avatarUrl;
    }

    public boolean isDisableServices() {
        return disableServices;
    }

    public void setDisableServices(boolean disableServices) {
        this.disableServices = disableServices;
    }

    public Duration getFetchConnectTimeout() {
        return fetchConnectTimeout;
    }

    public void setFetchConnectTimeout(Duration fetchConnectTimeout) {
        this.fetchConnectTimeout = fetchConnectTimeout;
    }

    public Duration getFetchReadTimeout() {
        return fetchReadTimeout;
    }

    public void setFetchReadTimeout(Duration fetchReadTimeout) {
        this.fetchReadTimeout = fetchReadTimeout;
    }
}
