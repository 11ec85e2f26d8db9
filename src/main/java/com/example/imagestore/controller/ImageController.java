package com.example.imagestore.controller;

import com.example.imagestore.exception.ImageNotFoundException;
import com.example.imagestore.exception.ImageStorageException;
import com.example.imagestore.exception.ImageStoreException;
import com.example.imagestore.exception.ImageUploadException;
import com.example.imagestore.exception.RemoteFetchException;
import com.example.imagestore.exception.ThumbnailCreationException;
import com.example.imagestore.model.ImageType;
import com.example.imagestore.model.ImageView;
import com.example.imagestore.persistence.document.ImageDocument;
import com.example.imagestore.service.ImageCleanupService;
import com.example.imagestore.service.ImageService;
import com.example.imagestore.service.ThumbnailService;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
public class ImageController {

    private static final Logger log = LoggerFactory.getLogger(ImageController.class);
    private static final String USER_HEADER = "X-User-Id";

    private final ImageService imageService;
    private final ThumbnailService thumbnailService;
    private final ImageCleanupService cleanupService;

    @PostMapping(path = "/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ImageView> upload(
        @RequestHeader(value = USER_HEADER, required = false) String userId,
        @RequestParam("file") MultipartFile file,
        @RequestParam("type") String type,
        @RequestParam(required = false) String uploadedTo,
        @RequestParam(required = false) @Positive Integer resizeWidth,
        @RequestParam(required = false) @Positive Integer resizeHeight,
        @RequestParam(defaultValue = "true") boolean keepRatio
    ) {
        ImageDocument image = imageService.saveNewFromUpload(
            file, ImageType.fromValue(type), uploadedTo, resizeWidth, resizeHeight, keepRatio, userId);
        return ResponseEntity.ok(imageService.toView(image));
    }

    @PostMapping("/images/base64")
    public ResponseEntity<ImageView> uploadBase64(
        @RequestHeader(value = USER_HEADER, required = false) String userId,
        @Valid @RequestBody Base64UploadRequest request
    ) {
        ImageDocument image = imageService.saveNewFromBase64Uri(
            request.data(), request.name(), ImageType.fromValue(request.type()), request.uploadedTo(), userId);
        return ResponseEntity.ok(imageService.toView(image));
    }

    @GetMapping("/images/{id}/thumbnail")
    public ResponseEntity<ThumbnailResponse> thumbnail(
        @PathVariable String id,
        @RequestParam(defaultValue = "220") @Positive int width,
        @RequestParam(defaultValue = "220") @Positive int height,
        @RequestParam(defaultValue = "false") boolean keepRatio
    ) {
        ImageDocument image = imageService.findImage(id);
        return ResponseEntity.ok(new ThumbnailResponse(thumbnailService.getThumbnail(image, width, height, keepRatio)));
    }

    @DeleteMapping("/images/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        cleanupService.destroy(imageService.findImage(id));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/users/{userId}/avatar")
    public ResponseEntity<ImageView> fetchAvatar(
        @PathVariable String userId,
        @Valid @RequestBody AvatarRequest request
    ) {
        if (!imageService.avatarFetchEnabled()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
        ImageDocument image = imageService.saveUserAvatar(userId, request.email(), request.name(), request.size());
        return ResponseEntity.ok(imageService.toView(image));
    }

    @ExceptionHandler({ImageNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(ImageNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler({ImageUploadException.class})
    public ResponseEntity<ErrorResponse> handleInvalidUpload(ImageUploadException ex) {
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler({ThumbnailCreationException.class})
    public ResponseEntity<ErrorResponse> handleThumbnail(ThumbnailCreationException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex);
    }

    @ExceptionHandler({RemoteFetchException.class})
    public ResponseEntity<ErrorResponse> handleRemoteFetch(RemoteFetchException ex) {
        return error(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler({ImageStorageException.class})
    public ResponseEntity<ErrorResponse> handleStorage(ImageStorageException ex) {
        log.error("Image storage failure", ex);
        return error(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler({ImageStoreException.class})
    public ResponseEntity<ErrorResponse> handleGeneric(ImageStoreException ex) {
        log.error("Image operation failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponse> handleIllegalArgument(RuntimeException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ErrorResponse("bad_request", ex.getMessage()));
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, ImageStoreException ex) {
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getError(), ex.getMessage()));
    }

    public record Base64UploadRequest(@NotBlank String data, @NotBlank String name, @NotBlank String type, String uploadedTo) {}

    public record AvatarRequest(@NotBlank String email, @NotBlank String name, @Min(1) int size) {}

    public record ThumbnailResponse(String url) {}

    public record ErrorResponse(String error, String message) {}
}
