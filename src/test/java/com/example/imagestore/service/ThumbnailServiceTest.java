package com.example.imagestore.service;

import com.example.imagestore.cache.CaffeineExistenceCache;
import com.example.imagestore.cache.ExistenceCache;
import com.example.imagestore.config.ImageProperties;
import com.example.imagestore.config.StorageProperties;
import com.example.imagestore.exception.ThumbnailCreationException;
import com.example.imagestore.model.ImageType;
import com.example.imagestore.persistence.document.ImageDocument;
import com.example.imagestore.storage.ImageStorageResolver;
import com.example.imagestore.storage.LocalImageStorage;
import com.example.imagestore.storage.StorageBackend;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class ThumbnailServiceTest {

    private static final String SOURCE = "uploads/images/gallery/2024-03/cat.png";
    private static final String BASE = "http://localhost:8080/";

    @TempDir
    Path tempDir;

    private LocalImageStorage storage;
    private ExistenceCache cache;
    private ImageResizer resizer;
    private ThumbnailService service;
    private ImageDocument image;

    @BeforeEach
    void setUp() {
        StorageProperties storageProperties = new StorageProperties();
        ImageProperties imageProperties = new ImageProperties();
        storage = new LocalImageStorage(StorageBackend.LOCAL, tempDir);
        cache = new CaffeineExistenceCache(100, Ticker.systemTicker());
        resizer = mock(ImageResizer.class);
        when(resizer.resize(any(), anyInt(), anyInt(), anyBoolean())).thenReturn("thumb".getBytes(StandardCharsets.UTF_8));

        service = new ThumbnailService(
            new ImageStorageResolver(storageProperties, List.of(storage)),
            cache,
            resizer,
            new ImageUrlResolver(storageProperties, imageProperties),
            imageProperties
        );

        storage.put(SOURCE, "source".getBytes(StandardCharsets.UTF_8));
        image = ImageDocument.builder().id("img-1").path(SOURCE).type(ImageType.GALLERY).build();
    }

    @Test
    void getThumbnail_should_createCroppedVariant_onFirstRequest() {
        String url = service.getThumbnail(image, 220, 220, false);

        String thumbPath = "uploads/images/gallery/2024-03/thumbs-220-220/cat.png";
        assertEquals(BASE + thumbPath, url);
        assertArrayEquals("thumb".getBytes(StandardCharsets.UTF_8), storage.get(thumbPath));
        assertTrue(cache.has("images-img-1-" + thumbPath));
        verify(resizer).resize("source".getBytes(StandardCharsets.UTF_8), 220, 220, false);
    }

    @Test
    void getThumbnail_secondRequest_should_notResizeAgain() {
        String first = service.getThumbnail(image, 150, 100, true);
        String second = service.getThumbnail(image, 150, 100, true);

        assertEquals(first, second);
        assertEquals(BASE + "uploads/images/gallery/2024-03/scaled-150-100/cat.png", second);
        verify(resizer, times(1)).resize(any(), anyInt(), anyInt(), anyBoolean());
    }

    @Test
    void getThumbnail_existingInStorage_should_skipResize_andRemember() {
        String thumbPath = "uploads/images/gallery/2024-03/thumbs-220-220/cat.png";
        storage.put(thumbPath, "older".getBytes(StandardCharsets.UTF_8));

        String url = service.getThumbnail(image, 220, 220, false);

        assertEquals(BASE + thumbPath, url);
        assertTrue(cache.has("images-img-1-" + thumbPath));
        verifyNoInteractions(resizer);
    }

    @Test
    void getThumbnail_cacheHit_should_notTouchStorage() {
        String thumbPath = "uploads/images/gallery/2024-03/thumbs-50-50/cat.png";
        cache.put("images-img-1-" + thumbPath, thumbPath, new ImageProperties().getThumbnailCacheTtl());

        String url = service.getThumbnail(image, 50, 50, false);

        assertEquals(BASE + thumbPath, url);
        assertFalse(storage.exists(thumbPath));
        verifyNoInteractions(resizer);
    }

    @Test
    void getThumbnail_animatedWithKeepRatio_should_returnSourceUrl() {
        image.setPath("uploads/images/gallery/2024-03/dance.GIF");

        String url = service.getThumbnail(image, 200, 200, true);

        assertEquals(BASE + "uploads/images/gallery/2024-03/dance.GIF", url);
        verifyNoInteractions(resizer);
        assertTrue(storage.directories("uploads/images/gallery/2024-03").isEmpty());
    }

    @Test
    void getThumbnail_animatedCropped_should_stillResize() {
        String gif = "uploads/images/gallery/2024-03/dance.gif";
        storage.put(gif, "gif".getBytes(StandardCharsets.UTF_8));
        image.setPath(gif);

        String url = service.getThumbnail(image, 100, 100, false);

        assertEquals(BASE + "uploads/images/gallery/2024-03/thumbs-100-100/dance.gif", url);
        verify(resizer).resize(any(), eq(100), eq(100), eq(false));
    }

    @Test
    void getThumbnail_codecFailure_should_propagate_andWriteNothing() {
        reset(resizer);
        when(resizer.resize(any(), anyInt(), anyInt(), anyBoolean()))
            .thenThrow(new ThumbnailCreationException("Cannot create thumbnail: image data is corrupt"));

        assertThrows(ThumbnailCreationException.class, () -> service.getThumbnail(image, 220, 220, false));

        assertFalse(storage.exists("uploads/images/gallery/2024-03/thumbs-220-220/cat.png"));
        assertFalse(cache.has("images-img-1-uploads/images/gallery/2024-03/thumbs-220-220/cat.png"));
    }

    @Test
    void thumbnailPath_should_encodeModeAndSize() {
        assertEquals("a/b/thumbs-10-20/c.jpg", ThumbnailService.thumbnailPath("a/b/c.jpg", 10, 20, false));
        assertEquals("a/b/scaled-10-20/c.jpg", ThumbnailService.thumbnailPath("a/b/c.jpg", 10, 20, true));
    }
}
