package com.example.imagestore.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Expiring key/value hints. Only ever used to remember that something exists; a miss says nothing.
 */
public interface ExistenceCache {

    boolean has(String key);

    Optional<String> get(String key);

    void put(String key, String value, Duration ttl);
}
