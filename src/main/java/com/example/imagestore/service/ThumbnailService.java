package com.example.imagestore.service;

import com.example.imagestore.cache.ExistenceCache;
import com.example.imagestore.config.ImageProperties;
import com.example.imagestore.persistence.document.ImageDocument;
import com.example.imagestore.storage.ImageStorage;
import com.example.imagestore.storage.ImageStorageResolver;
import com.example.imagestore.util.ImagePaths;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Serves resized variants of source images. A variant lives next to its source, in a
 * {@code thumbs-<w>-<h>} (cropped) or {@code scaled-<w>-<h>} (aspect kept) directory, under the
 * source's file name, so its location follows from the request alone.
 * <p>
 * Lookups check the existence cache, then storage, and only then resize. Concurrent requests for the
 * same missing variant may both resize and write it; the writes are whole-object and identical.
 */
@Service
@RequiredArgsConstructor
public class ThumbnailService {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailService.class);
    private static final Set<String> ANIMATED_EXTENSIONS = Set.of("gif");
    private static final String CACHE_PREFIX = "images-";

    private final ImageStorageResolver storageResolver;
    private final ExistenceCache existenceCache;
    private final ImageResizer imageResizer;
    private final ImageUrlResolver urlResolver;
    private final ImageProperties properties;

    public String getThumbnail(ImageDocument image, int width, int height, boolean keepRatio) {
        if (keepRatio && isAnimated(image.getPath())) {
            return urlResolver.toPublicUrl(image.getPath());
        }

        String thumbPath = thumbnailPath(image.getPath(), width, height, keepRatio);
        String cacheKey = cacheKey(image, thumbPath);

        if (existenceCache.has(cacheKey)) {
            log.debug("Thumbnail cache hit for {}", thumbPath);
            return urlResolver.toPublicUrl(thumbPath);
        }

        ImageStorage storage = storageResolver.forType(image.getType());
        if (storage.exists(thumbPath)) {
            log.debug("Thumbnail {} found in storage", thumbPath);
            existenceCache.put(cacheKey, thumbPath, properties.getThumbnailCacheTtl());
            return urlResolver.toPublicUrl(thumbPath);
        }

        byte[] thumbData = imageResizer.resize(storage.get(image.getPath()), width, height, keepRatio);
        storage.put(thumbPath, thumbData);
        storage.setPublic(thumbPath);
        existenceCache.put(cacheKey, thumbPath, properties.getThumbnailCacheTtl());
        log.info("Created thumbnail {} ({} bytes)", thumbPath, thumbData.length);

        return urlResolver.toPublicUrl(thumbPath);
    }

    public static String thumbnailPath(String sourcePath, int width, int height, boolean keepRatio) {
        String directoryName = (keepRatio ? "scaled-" : "thumbs-") + width + "-" + height;
        return ImagePaths.join(ImagePaths.directory(sourcePath) + "/" + directoryName, ImagePaths.fileName(sourcePath));
    }

    public static boolean isAnimated(String path) {
        return ANIMATED_EXTENSIONS.contains(ImagePaths.extension(path));
    }

    private String cacheKey(ImageDocument image, String thumbPath) {
        return CACHE_PREFIX + image.getId() + "-" + thumbPath;
    }
}
