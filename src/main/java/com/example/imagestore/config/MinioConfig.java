package com.example.imagestore.config;

import com.example.imagestore.storage.MinioImageStorage;
import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "app.storage", name = "type", havingValue = "s3")
public class MinioConfig {

    private static final Logger log = LoggerFactory.getLogger(MinioConfig.class);

    @Bean
    public MinioClient minioClient(StorageProperties properties) throws Exception {
        MinioClient.Builder builder = MinioClient.builder()
            .endpoint(properties.getEndpoint())
            .credentials(properties.getAccessKey(), properties.getSecretKey());
        if (hasRegion(properties)) {
            builder.region(properties.getRegion());
        }
        MinioClient client = builder.build();

        ensureBucket(client, properties);

        return client;
    }

    @Bean
    public MinioImageStorage minioImageStorage(MinioClient minioClient, StorageProperties properties) {
        return new MinioImageStorage(minioClient, properties.getBucket());
    }

    private void ensureBucket(MinioClient client, StorageProperties properties) throws Exception {
        String name = properties.getBucket();
        boolean exists = client.bucketExists(BucketExistsArgs.builder().bucket(name).build());
        if (!exists) {
            log.info("Creating image bucket {}", name);
            MakeBucketArgs.Builder builder = MakeBucketArgs.builder().bucket(name);
            if (hasRegion(properties)) {
                builder.region(properties.getRegion());
            }
            client.makeBucket(builder.build());
        }
    }

    private boolean hasRegion(StorageProperties properties) {
        return properties.getRegion() != null && !properties.getRegion().isBlank();
    }
}
