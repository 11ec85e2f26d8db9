package com.example.imagestore.service;

import com.example.imagestore.config.ImageProperties;
import com.example.imagestore.model.ImageType;
import com.example.imagestore.persistence.document.ImageDocument;
import com.example.imagestore.persistence.repository.ImageRepository;
import com.example.imagestore.persistence.repository.PageRepository;
import com.example.imagestore.persistence.repository.PageRevisionRepository;
import com.example.imagestore.storage.ImageStorage;
import com.example.imagestore.storage.ImageStorageResolver;
import com.example.imagestore.util.ImagePaths;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class ImageCleanupService {

    private static final Logger log = LoggerFactory.getLogger(ImageCleanupService.class);

    /**
     * Only these types are ever swept; the others (avatars, system images, covers) are never orphan candidates.
     */
    public static final Set<ImageType> SWEEPABLE_TYPES = EnumSet.of(ImageType.GALLERY, ImageType.DRAWIO);

    private final ImageStorageResolver storageResolver;
    private final ImageRepository imageRepository;
    private final PageRepository pageRepository;
    private final PageRevisionRepository pageRevisionRepository;
    private final ImageProperties properties;

    /**
     * Deletes the source file, every thumbnail of it and the directories that end up empty, then the record.
     * A storage failure stops the process before the record is touched.
     */
    public void destroy(ImageDocument image) {
        ImageStorage storage = storageResolver.forType(image.getType());
        String folder = ImagePaths.directory(image.getPath());
        String fileName = ImagePaths.fileName(image.getPath());

        List<String> toDelete = storage.allFiles(folder).stream()
            .filter(path -> ImagePaths.fileName(path).equals(fileName))
            .toList();
        storage.delete(toDelete);

        // children first, so the folder itself can be removed once its thumbnail directories are gone
        for (String directory : storage.directories(folder)) {
            deleteIfEmpty(storage, directory);
        }
        deleteIfEmpty(storage, folder);

        imageRepository.delete(image);
        log.info("Destroyed image {} ({} files removed)", image.getPath(), toDelete.size());
    }

    /**
     * Finds gallery and drawing images whose file name does not occur in any page (and, optionally, any page
     * revision). Returns their paths; they are only destroyed when {@code dryRun} is off.
     */
    public List<String> sweep(boolean checkRevisions, boolean dryRun, Collection<ImageType> types) {
        Set<ImageType> candidates = EnumSet.noneOf(ImageType.class);
        candidates.addAll(types == null || types.isEmpty() ? SWEEPABLE_TYPES : types);
        candidates.retainAll(SWEEPABLE_TYPES);

        List<String> unusedPaths = new ArrayList<>();
        if (candidates.isEmpty()) {
            return unusedPaths;
        }

        int batchSize = properties.getSweepBatchSize();
        int scanned = 0;
        List<ImageDocument> batch = imageRepository.findByTypeInOrderByIdAsc(candidates, PageRequest.ofSize(batchSize));
        while (!batch.isEmpty()) {
            for (ImageDocument image : batch) {
                scanned++;
                if (isReferenced(image, checkRevisions)) {
                    continue;
                }
                unusedPaths.add(image.getPath());
                if (!dryRun) {
                    destroy(image);
                }
            }
            if (batch.size() < batchSize) {
                break;
            }
            String lastId = batch.get(batch.size() - 1).getId();
            batch = imageRepository.findByTypeInAndIdGreaterThanOrderByIdAsc(candidates, lastId, PageRequest.ofSize(batchSize));
        }

        log.info("Image sweep scanned {} images of types {}, found {} unused (dryRun={})",
            scanned, candidates, unusedPaths.size(), dryRun);
        return unusedPaths;
    }

    private boolean isReferenced(ImageDocument image, boolean checkRevisions) {
        String fileName = ImagePaths.fileName(image.getPath());
        if (pageRepository.countByHtmlContaining(fileName) > 0) {
            return true;
        }
        return checkRevisions && pageRevisionRepository.countByHtmlContaining(fileName) > 0;
    }

    private void deleteIfEmpty(ImageStorage storage, String directory) {
        if (storage.files(directory).isEmpty() && storage.directories(directory).isEmpty()) {
            storage.deleteDirectory(directory);
        }
    }
}
