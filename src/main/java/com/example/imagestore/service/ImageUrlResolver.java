package com.example.imagestore.service;

import com.example.imagestore.config.ImageProperties;
import com.example.imagestore.config.StorageProperties;
import com.example.imagestore.storage.StorageBackend;
import com.example.imagestore.util.ImagePaths;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps storage paths to public URLs and back.
 */
@Component
public class ImageUrlResolver {

    private static final String S3_HOST = "s3.amazonaws.com";

    private final StorageProperties storageProperties;
    private final ImageProperties imageProperties;

    /**
     * Lazily computed public base URL. Storage configuration is fixed at startup, so it is never reset.
     */
    private volatile String publicBaseUrl;

    public ImageUrlResolver(StorageProperties storageProperties, ImageProperties imageProperties) {
        this.storageProperties = storageProperties;
        this.imageProperties = imageProperties;
    }

    public String toPublicUrl(String path) {
        return join(publicBaseUrl(), path);
    }

    /**
     * Resolves a URL found in content back to a storage path. Only our own image URLs and
     * relative paths rooted at {@code uploads/images} resolve; anything else is empty.
     */
    public Optional<String> toStoragePath(String url) {
        if (url == null) {
            return Optional.empty();
        }
        String candidate = url.trim().replaceAll("^/+", "");
        String lower = candidate.toLowerCase(Locale.ROOT);

        if (!lower.startsWith("http")) {
            if (lower.startsWith(ImagePaths.IMAGES_ROOT)) {
                return safe(ImagePaths.trimSlashes(candidate));
            }
            return Optional.empty();
        }

        List<String> knownBases = List.of(
            join(imageProperties.getBaseUrl(), ImagePaths.IMAGES_ROOT + "/"),
            join(publicBaseUrl(), ImagePaths.IMAGES_ROOT + "/")
        );
        for (String base : knownBases) {
            String lowerBase = base.toLowerCase(Locale.ROOT);
            if (lower.startsWith(lowerBase)) {
                String rest = ImagePaths.trimSlashes(candidate.substring(lowerBase.length()));
                return safe(ImagePaths.IMAGES_ROOT + "/" + rest);
            }
        }
        return Optional.empty();
    }

    String publicBaseUrl() {
        String base = publicBaseUrl;
        if (base == null) {
            base = computePublicBaseUrl();
            publicBaseUrl = base;
        }
        return base;
    }

    private String computePublicBaseUrl() {
        if (StringUtils.hasText(storageProperties.getUrl())) {
            return storageProperties.getUrl();
        }
        if (storageProperties.getType() == StorageBackend.S3) {
            String bucket = storageProperties.getBucket();
            // dotted bucket names break TLS certificate matching on virtual-hosted URLs
            if (!bucket.contains(".")) {
                return "https://" + bucket + "." + S3_HOST;
            }
            return "https://s3-" + storageProperties.getRegion() + ".amazonaws.com/" + bucket;
        }
        return imageProperties.getBaseUrl();
    }

    private Optional<String> safe(String path) {
        for (String segment : path.split("/")) {
            if (segment.equals("..")) {
                return Optional.empty();
            }
        }
        return Optional.of(path);
    }

    private static String join(String base, String path) {
        return base.replaceAll("/+$", "") + "/" + path.replaceAll("^/+", "");
    }
}
