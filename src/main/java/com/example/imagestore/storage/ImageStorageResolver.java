package com.example.imagestore.storage;

import com.example.imagestore.config.StorageProperties;
import com.example.imagestore.model.ImageType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the storage backend for an image type: the configured backend, unless the type has an
 * entry in the override table for that backend.
 */
@Component
public class ImageStorageResolver {

    private static final Map<ImageType, Map<StorageBackend, StorageBackend>> OVERRIDES = Map.of(
        // system images (logos and the like) must stay reachable without authentication
        ImageType.SYSTEM, Map.of(StorageBackend.LOCAL_SECURE, StorageBackend.LOCAL)
    );

    private final StorageProperties properties;
    private final Map<StorageBackend, ImageStorage> storages = new EnumMap<>(StorageBackend.class);

    public ImageStorageResolver(StorageProperties properties, List<ImageStorage> storages) {
        this.properties = properties;
        for (ImageStorage storage : storages) {
            this.storages.put(storage.backend(), storage);
        }
    }

    public ImageStorage forType(ImageType type) {
        StorageBackend backend = backendFor(type);
        ImageStorage storage = storages.get(backend);
        if (storage == null) {
            throw new IllegalStateException("No image storage registered for backend " + backend);
        }
        return storage;
    }

    public StorageBackend backendFor(ImageType type) {
        StorageBackend configured = properties.getType();
        if (type == null) {
            return configured;
        }
        return OVERRIDES.getOrDefault(type, Map.of()).getOrDefault(configured, configured);
    }
}
