package com.example.imagestore.storage;

import java.util.Collection;
import java.util.List;

/**
 * Byte storage addressed by logical, slash-separated paths such as
 * {@code uploads/images/gallery/2024-01/cat.png}.
 * <p>
 * Listing operations return paths in the same logical form. A directory that does not exist lists as empty.
 * Failures surface as {@link com.example.imagestore.exception.ImageStorageException}.
 */
public interface ImageStorage {

    StorageBackend backend();

    boolean exists(String path);

    /**
     * @throws com.example.imagestore.exception.ImageNotFoundException when nothing is stored at {@code path}
     */
    byte[] get(String path);

    /**
     * Writes the whole object, replacing any previous content.
     */
    void put(String path, byte[] data);

    void setPublic(String path);

    void delete(String path);

    void delete(Collection<String> paths);

    /**
     * Files directly inside {@code directory}.
     */
    List<String> files(String directory);

    /**
     * Directories directly inside {@code directory}.
     */
    List<String> directories(String directory);

    /**
     * Files anywhere below {@code directory}.
     */
    List<String> allFiles(String directory);

    void deleteDirectory(String directory);
}
