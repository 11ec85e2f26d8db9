package com.example.imagestore.config;

import com.example.imagestore.storage.LocalImageStorage;
import com.example.imagestore.storage.StorageBackend;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean
    public LocalImageStorage publicImageStorage(StorageProperties properties) {
        return new LocalImageStorage(StorageBackend.LOCAL, Paths.get(properties.getLocalRoot()));
    }

    @Bean
    public LocalImageStorage secureImageStorage(StorageProperties properties) {
        return new LocalImageStorage(StorageBackend.LOCAL_SECURE, Paths.get(properties.getLocalSecureRoot()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
