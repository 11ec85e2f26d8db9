package com.example.imagestore.service;

import com.example.imagestore.config.ImageProperties;
import com.example.imagestore.exception.ImageNotFoundException;
import com.example.imagestore.exception.ImageStorageException;
import com.example.imagestore.exception.ImageUploadException;
import com.example.imagestore.exception.RemoteFetchException;
import com.example.imagestore.exception.StorageWriteException;
import com.example.imagestore.model.ImageType;
import com.example.imagestore.model.ImageView;
import com.example.imagestore.persistence.document.ImageDocument;
import com.example.imagestore.persistence.repository.ImageRepository;
import com.example.imagestore.storage.ImageStorage;
import com.example.imagestore.storage.ImageStorageResolver;
import com.example.imagestore.util.ImagePaths;
import lombok.RequiredArgsConstructor;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for bringing new images into storage and reading them back.
 */
@Service
@RequiredArgsConstructor
public class ImageService {

    private static final Logger log = LoggerFactory.getLogger(ImageService.class);
    private static final String BASE64_DELIMITER = ";base64,";
    private static final String DEFAULT_AVATAR_URL = "https://www.gravatar.com/avatar/${hash}?s=${size}&d=identicon";

    private final ImageStorageResolver storageResolver;
    private final ImagePathNamer pathNamer;
    private final ImageUrlResolver urlResolver;
    private final ImageRepository imageRepository;
    private final ImageResizer imageResizer;
    private final RemoteImageFetcher remoteImageFetcher;
    private final ImageProperties properties;
    private final Clock clock;

    /**
     * Stores an uploaded file, resizing it first when a width or height is given.
     */
    public ImageDocument saveNewFromUpload(
        MultipartFile file,
        ImageType type,
        String uploadedTo,
        Integer resizeWidth,
        Integer resizeHeight,
        boolean keepRatio,
        String userId
    ) {
        if (file == null || file.isEmpty()) {
            throw new ImageUploadException("No image file provided");
        }
        String imageName = Optional.ofNullable(file.getOriginalFilename())
            .filter(StringUtils::hasText)
            .orElse("image");

        byte[] imageData;
        try {
            imageData = file.getBytes();
        } catch (IOException ex) {
            throw new ImageUploadException("Could not read uploaded file " + imageName, ex);
        }

        if (resizeWidth != null || resizeHeight != null) {
            imageData = imageResizer.resize(
                imageData,
                resizeWidth == null ? 0 : resizeWidth,
                resizeHeight == null ? 0 : resizeHeight,
                keepRatio
            );
        }

        return saveNew(imageName, imageData, type, uploadedTo, userId);
    }

    /**
     * Stores an image given as a data URI, e.g. {@code data:image/png;base64,iVBOR...}.
     */
    public ImageDocument saveNewFromBase64Uri(String base64Uri, String name, ImageType type, String uploadedTo, String userId) {
        int delimiter = base64Uri == null ? -1 : base64Uri.indexOf(BASE64_DELIMITER);
        if (delimiter < 0) {
            throw new ImageUploadException("Invalid base64 image data provided");
        }
        byte[] data;
        try {
            data = Base64.getMimeDecoder().decode(base64Uri.substring(delimiter + BASE64_DELIMITER.length()));
        } catch (IllegalArgumentException ex) {
            throw new ImageUploadException("Invalid base64 image data provided", ex);
        }
        if (data.length == 0) {
            throw new ImageUploadException("Invalid base64 image data provided");
        }
        return saveNew(name, data, type, uploadedTo, userId);
    }

    /**
     * Downloads and stores a remote image. The name defaults to the last segment of the URL.
     */
    public ImageDocument saveNewFromUrl(String url, ImageType type, String imageName) {
        String name = StringUtils.hasText(imageName) ? imageName : ImagePaths.fileName(url);
        byte[] imageData;
        try {
            imageData = remoteImageFetcher.fetch(url);
        } catch (RemoteFetchException ex) {
            throw new RemoteFetchException("Cannot fetch image from URL " + url, ex);
        }
        return saveNew(name, imageData, type, null, null);
    }

    /**
     * Fetches an avatar for the user from the configured avatar service and stores it as a {@code user} image.
     */
    public ImageDocument saveUserAvatar(String userId, String email, String displayName, int size) {
        String normalizedEmail = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        Map<String, String> replacements = Map.of(
            "${hash}", DigestUtils.md5Hex(normalizedEmail),
            "${size}", Integer.toString(size),
            "${email}", URLEncoder.encode(normalizedEmail, StandardCharsets.UTF_8)
        );
        String avatarUrl = avatarUrl();
        for (Map.Entry<String, String> replacement : replacements.entrySet()) {
            avatarUrl = avatarUrl.replace(replacement.getKey(), replacement.getValue());
        }

        String imageName = (displayName + "-avatar.png").replace(' ', '-');
        ImageDocument image = saveNewFromUrl(avatarUrl, ImageType.USER, imageName);
        image.setCreatedBy(userId);
        image.setUpdatedBy(userId);
        image.setUploadedTo(userId);
        image.setUpdatedAt(Instant.now(clock));
        return imageRepository.save(image);
    }

    public boolean avatarFetchEnabled() {
        String url = avatarUrl();
        return url != null && url.startsWith("http");
    }

    public ImageDocument findImage(String id) {
        return imageRepository.findById(id)
            .orElseThrow(() -> new ImageNotFoundException("Image not found: " + id));
    }

    public byte[] getImageData(ImageDocument image) {
        return storageResolver.forType(image.getType()).get(image.getPath());
    }

    /**
     * Reads an image referenced by URL from our own storage and returns it as a data URI.
     * Empty when the URL is not one of ours or nothing is stored there.
     */
    public Optional<String> imageUriToBase64(String uri) {
        if (!StringUtils.hasText(uri)) {
            return Optional.empty();
        }
        Optional<String> storagePath = urlResolver.toStoragePath(uri);
        if (storagePath.isEmpty()) {
            return Optional.empty();
        }

        String path = storagePath.get();
        ImageStorage storage = storageResolver.forType(typeOf(path));
        if (!storage.exists(path)) {
            return Optional.empty();
        }

        String extension = ImagePaths.extension(path);
        if (extension.equals("svg")) {
            extension = "svg+xml";
        }
        return Optional.of("data:image/" + extension + ";base64," + Base64.getEncoder().encodeToString(storage.get(path)));
    }

    public ImageView toView(ImageDocument document) {
        return ImageView.builder()
            .id(document.getId())
            .name(document.getName())
            .path(document.getPath())
            .url(document.getUrl())
            .type(document.getType())
            .uploadedTo(document.getUploadedTo())
            .createdBy(document.getCreatedBy())
            .createdAt(document.getCreatedAt() == null ? 0 : document.getCreatedAt().toEpochMilli())
            .build();
    }

    private ImageDocument saveNew(String imageName, byte[] imageData, ImageType type, String uploadedTo, String userId) {
        ImageStorage storage = storageResolver.forType(type);
        String path = pathNamer.newSourcePath(imageName, type, storage::exists);

        try {
            storage.put(path, imageData);
            storage.setPublic(path);
        } catch (ImageStorageException ex) {
            throw new StorageWriteException("Image path " + path + " is not writable", ex);
        }

        Instant now = Instant.now(clock);
        ImageDocument document = ImageDocument.builder()
            .name(imageName)
            .path(path)
            .url(urlResolver.toPublicUrl(path))
            .type(type)
            .uploadedTo(uploadedTo)
            .createdBy(userId)
            .updatedBy(userId)
            .createdAt(now)
            .updatedAt(now)
            .build();

        ImageDocument saved = imageRepository.save(document);
        log.info("Stored {} image {} ({} bytes)", type.getValue(), path, imageData.length);
        return saved;
    }

    /**
     * Type encoded in {@code uploads/images/<type>/...}, or {@code null} for an unknown segment.
     */
    private ImageType typeOf(String path) {
        String[] segments = path.split("/");
        if (segments.length < 3) {
            return null;
        }
        try {
            return ImageType.fromValue(segments[2]);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private String avatarUrl() {
        String url = properties.getAvatarUrl() == null ? "" : properties.getAvatarUrl().trim();
        if (url.isEmpty() && !properties.isDisableServices()) {
            return DEFAULT_AVATAR_URL;
        }
        return url;
    }
}
