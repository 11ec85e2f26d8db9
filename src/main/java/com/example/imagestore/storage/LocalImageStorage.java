package com.example.imagestore.storage;

import com.example.imagestore.exception.ImageNotFoundException;
import com.example.imagestore.exception.ImageStorageException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores images below a root directory on the local file system.
 */
public class LocalImageStorage implements ImageStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalImageStorage.class);
    private static final Set<PosixFilePermission> PUBLIC_PERMISSIONS = EnumSet.of(
        PosixFilePermission.OWNER_READ,
        PosixFilePermission.OWNER_WRITE,
        PosixFilePermission.GROUP_READ,
        PosixFilePermission.OTHERS_READ
    );

    private static final String TEMP_PREFIX = ".put-";
    private static final String TEMP_SUFFIX = ".tmp";

    private final StorageBackend backend;
    private final Path root;

    public LocalImageStorage(StorageBackend backend, Path root) {
        this.backend = backend;
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public StorageBackend backend() {
        return backend;
    }

    @Override
    public boolean exists(String path) {
        return Files.isRegularFile(resolve(path));
    }

    @Override
    public byte[] get(String path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new ImageNotFoundException("Image file not found: " + path);
        }
        try {
            return FileUtils.readFileToByteArray(file.toFile());
        } catch (IOException ex) {
            throw new ImageStorageException("Failed to read " + path, ex);
        }
    }

    @Override
    public void put(String path, byte[] data) {
        Path file = resolve(path);
        Path temp = null;
        try {
            Files.createDirectories(file.getParent());
            // written next to the target and moved into place, so readers never see a partial file
            temp = Files.createTempFile(file.getParent(), TEMP_PREFIX, TEMP_SUFFIX);
            FileUtils.writeByteArrayToFile(temp.toFile(), data);
            moveIntoPlace(temp, file);
        } catch (IOException ex) {
            if (temp != null) {
                FileUtils.deleteQuietly(temp.toFile());
            }
            throw new ImageStorageException("Failed to write " + path, ex);
        }
    }

    @Override
    public void setPublic(String path) {
        Path file = resolve(path);
        if (Files.getFileAttributeView(file, PosixFileAttributeView.class) == null) {
            return;
        }
        try {
            Files.setPosixFilePermissions(file, PUBLIC_PERMISSIONS);
        } catch (IOException ex) {
            throw new ImageStorageException("Failed to change visibility of " + path, ex);
        }
    }

    @Override
    public void delete(String path) {
        try {
            Files.deleteIfExists(resolve(path));
        } catch (IOException ex) {
            throw new ImageStorageException("Failed to delete " + path, ex);
        }
    }

    @Override
    public void delete(Collection<String> paths) {
        for (String path : paths) {
            delete(path);
        }
    }

    @Override
    public List<String> files(String directory) {
        return list(directory, Files::isRegularFile, false);
    }

    @Override
    public List<String> directories(String directory) {
        return list(directory, Files::isDirectory, false);
    }

    @Override
    public List<String> allFiles(String directory) {
        return list(directory, Files::isRegularFile, true);
    }

    @Override
    public void deleteDirectory(String directory) {
        Path dir = resolve(directory);
        if (dir.equals(root)) {
            throw new ImageStorageException("Refusing to delete the storage root");
        }
        try {
            FileUtils.deleteDirectory(dir.toFile());
            log.debug("Deleted directory {}", directory);
        } catch (IOException ex) {
            throw new ImageStorageException("Failed to delete directory " + directory, ex);
        }
    }

    private List<String> list(String directory, Predicate<Path> filter, boolean recursive) {
        Path dir = resolve(directory);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> entries = recursive ? Files.walk(dir) : Files.list(dir)) {
            return entries
                .filter(entry -> !entry.equals(dir))
                .filter(entry -> !isTempFile(entry))
                .filter(filter)
                .map(this::toLogicalPath)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new ImageStorageException("Failed to list " + directory, ex);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            log.debug("Atomic move not supported for {}, falling back to a plain move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isTempFile(Path entry) {
        String name = entry.getFileName().toString();
        return name.startsWith(TEMP_PREFIX) && name.endsWith(TEMP_SUFFIX);
    }

    private Path resolve(String path) {
        String relative = path == null ? "" : path.replaceAll("^/+", "");
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new ImageStorageException("Path escapes storage root: " + path);
        }
        return resolved;
    }

    private String toLogicalPath(Path absolute) {
        return root.relativize(absolute).toString().replace(File.separatorChar, '/');
    }
}
