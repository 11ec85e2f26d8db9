package com.example.imagestore.storage;

import com.example.imagestore.exception.ImageNotFoundException;
import com.example.imagestore.exception.ImageStorageException;
import io.minio.CopyObjectArgs;
import io.minio.CopySource;
import io.minio.Directive;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.RemoveObjectsArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.DeleteError;
import io.minio.messages.DeleteObject;
import io.minio.messages.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stores images in a single S3-compatible bucket. Directories are key prefixes, so an empty
 * directory never exists on its own.
 */
public class MinioImageStorage implements ImageStorage {

    private static final Logger log = LoggerFactory.getLogger(MinioImageStorage.class);
    private static final Set<String> MISSING_CODES = Set.of("NoSuchKey", "NoSuchObject");
    private static final String ACL_HEADER = "x-amz-acl";
    private static final String PUBLIC_READ = "public-read";

    private final MinioClient client;
    private final String bucket;

    public MinioImageStorage(MinioClient client, String bucket) {
        this.client = client;
        this.bucket = bucket;
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.S3;
    }

    @Override
    public boolean exists(String path) {
        try {
            client.statObject(StatObjectArgs.builder()
                .bucket(bucket)
                .object(key(path))
                .build());
            return true;
        } catch (ErrorResponseException ex) {
            if (isMissing(ex)) {
                return false;
            }
            throw new ImageStorageException("Failed to stat " + path, ex);
        } catch (Exception ex) {
            throw new ImageStorageException("Failed to stat " + path, ex);
        }
    }

    @Override
    public byte[] get(String path) {
        try (GetObjectResponse in = client.getObject(GetObjectArgs.builder()
            .bucket(bucket)
            .object(key(path))
            .build())) {
            return in.readAllBytes();
        } catch (ErrorResponseException ex) {
            if (isMissing(ex)) {
                throw new ImageNotFoundException("Image object not found: " + path, ex);
            }
            throw new ImageStorageException("Failed to read " + path, ex);
        } catch (Exception ex) {
            throw new ImageStorageException("Failed to read " + path, ex);
        }
    }

    @Override
    public void put(String path, byte[] data) {
        try {
            client.putObject(PutObjectArgs.builder()
                .bucket(bucket)
                .object(key(path))
                .stream(new ByteArrayInputStream(data), data.length, -1)
                .contentType(contentType(path))
                .build());
        } catch (Exception ex) {
            throw new ImageStorageException("Failed to write " + path, ex);
        }
    }

    @Override
    public void setPublic(String path) {
        String object = key(path);
        try {
            client.copyObject(CopyObjectArgs.builder()
                .bucket(bucket)
                .object(object)
                .source(CopySource.builder().bucket(bucket).object(object).build())
                .metadataDirective(Directive.REPLACE)
                .headers(Map.of(ACL_HEADER, PUBLIC_READ, "Content-Type", contentType(path)))
                .build());
        } catch (Exception ex) {
            throw new ImageStorageException("Failed to change visibility of " + path, ex);
        }
    }

    @Override
    public void delete(String path) {
        try {
            client.removeObject(RemoveObjectArgs.builder()
                .bucket(bucket)
                .object(key(path))
                .build());
        } catch (Exception ex) {
            throw new ImageStorageException("Failed to delete " + path, ex);
        }
    }

    @Override
    public void delete(Collection<String> paths) {
        if (paths.isEmpty()) {
            return;
        }
        List<DeleteObject> objects = paths.stream()
            .map(path -> new DeleteObject(key(path)))
            .toList();
        Iterable<Result<DeleteError>> results = client.removeObjects(RemoveObjectsArgs.builder()
            .bucket(bucket)
            .objects(objects)
            .build());
        // removeObjects is lazy: the request is only sent while the results are consumed
        List<String> failures = new ArrayList<>();
        for (Result<DeleteError> result : results) {
            try {
                DeleteError error = result.get();
                failures.add(error.objectName() + " (" + error.message() + ")");
            } catch (Exception ex) {
                throw new ImageStorageException("Failed to delete objects in " + bucket, ex);
            }
        }
        if (!failures.isEmpty()) {
            throw new ImageStorageException("Failed to delete " + String.join(", ", failures));
        }
    }

    @Override
    public List<String> files(String directory) {
        return list(directory, false, false);
    }

    @Override
    public List<String> directories(String directory) {
        return list(directory, false, true);
    }

    @Override
    public List<String> allFiles(String directory) {
        return list(directory, true, false);
    }

    @Override
    public void deleteDirectory(String directory) {
        List<String> objects = allFiles(directory);
        delete(objects);
        log.debug("Deleted {} objects under {}", objects.size(), directory);
    }

    private List<String> list(String directory, boolean recursive, boolean directoriesOnly) {
        Iterable<Result<Item>> results = client.listObjects(ListObjectsArgs.builder()
            .bucket(bucket)
            .prefix(prefix(directory))
            .recursive(recursive)
            .build());
        List<String> paths = new ArrayList<>();
        for (Result<Item> result : results) {
            Item item;
            try {
                item = result.get();
            } catch (Exception ex) {
                throw new ImageStorageException("Failed to list " + directory, ex);
            }
            if (item.isDir() == directoriesOnly) {
                paths.add(stripTrailingSlash(item.objectName()));
            }
        }
        return paths;
    }

    private boolean isMissing(ErrorResponseException ex) {
        return ex.errorResponse() != null && MISSING_CODES.contains(ex.errorResponse().code());
    }

    private String key(String path) {
        return path.replaceAll("^/+", "");
    }

    private String prefix(String directory) {
        String key = stripTrailingSlash(key(directory));
        return key.isEmpty() ? "" : key + "/";
    }

    private String stripTrailingSlash(String value) {
        return value.replaceAll("/+$", "");
    }

    private String contentType(String path) {
        return MediaTypeFactory.getMediaType(path)
            .map(MediaType::toString)
            .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }
}
