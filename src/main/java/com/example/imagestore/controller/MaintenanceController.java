package com.example.imagestore.controller;

import com.example.imagestore.controller.ImageController.ErrorResponse;
import com.example.imagestore.exception.ImageStorageException;
import com.example.imagestore.exception.ImageStoreException;
import com.example.imagestore.model.ImageType;
import com.example.imagestore.model.SweepResult;
import com.example.imagestore.service.ImageCleanupService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/maintenance")
@RequiredArgsConstructor
public class MaintenanceController {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceController.class);

    private final ImageCleanupService cleanupService;

    @PostMapping("/images/sweep")
    public ResponseEntity<SweepResult> sweep(@RequestBody SweepRequest request) {
        boolean dryRun = request.dryRun() == null || request.dryRun();
        boolean checkRevisions = request.checkRevisions() == null || request.checkRevisions();
        List<ImageType> types = request.types() == null
            ? List.of()
            : request.types().stream().map(ImageType::fromValue).toList();

        List<String> paths = cleanupService.sweep(checkRevisions, dryRun, types);
        return ResponseEntity.ok(SweepResult.builder()
            .paths(paths)
            .dryRun(dryRun)
            .build());
    }

    @ExceptionHandler({ImageStorageException.class})
    public ResponseEntity<ErrorResponse> handleStorage(ImageStorageException ex) {
        log.error("Image sweep failed on storage", ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse(ex.getError(), ex.getMessage()));
    }

    @ExceptionHandler({ImageStoreException.class})
    public ResponseEntity<ErrorResponse> handleGeneric(ImageStoreException ex) {
        log.error("Image sweep failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(ex.getError(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", ex.getMessage()));
    }

    /**
     * Missing flags default to the safe side: check revisions, do not delete.
     */
    public record SweepRequest(Boolean checkRevisions, Boolean dryRun, List<String> types) {}
}
