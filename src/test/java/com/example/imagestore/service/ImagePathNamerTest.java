package com.example.imagestore.service;

import com.example.imagestore.config.ImageProperties;
import com.example.imagestore.model.ImageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImagePathNamerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);
    private ImageProperties properties;
    private ImagePathNamer namer;

    @BeforeEach
    void setUp() {
        properties = new ImageProperties();
        namer = new ImagePathNamer(properties, clock);
    }

    @Test
    void newSourcePath_should_slugName_underTypeAndMonth() {
        String path = namer.newSourcePath("My Photo.PNG", ImageType.GALLERY, p -> false);

        assertEquals("uploads/images/gallery/2024-03/my-photo.PNG", path);
    }

    @Test
    void newSourcePath_should_prefixRandomChars_untilFree() {
        Set<String> taken = new HashSet<>(Set.of("uploads/images/gallery/2024-03/cat.jpg"));

        String path = namer.newSourcePath("cat.jpg", ImageType.GALLERY, taken::contains);

        assertTrue(path.startsWith("uploads/images/gallery/2024-03/"));
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        assertEquals(3 + "cat.jpg".length(), fileName.length());
        assertTrue(fileName.endsWith("cat.jpg"));
        assertTrue(fileName.substring(0, 3).matches("[A-Za-z0-9]{3}"));
    }

    @Test
    void newSourcePath_should_keepProbing_whenPrefixedNameIsAlsoTaken() {
        int[] checks = {0};

        String path = namer.newSourcePath("cat.jpg", ImageType.DRAWIO, p -> ++checks[0] <= 2);

        assertEquals(3, checks[0]);
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        assertEquals(6 + "cat.jpg".length(), fileName.length());
    }

    @Test
    void newSourcePath_secureUploads_should_addTokenBeforeName() {
        properties.setSecureUploads(true);

        String path = namer.newSourcePath("cat.jpg", ImageType.COVER, p -> false);

        String fileName = path.substring(path.lastIndexOf('/') + 1);
        assertTrue(path.startsWith("uploads/images/cover/2024-03/"));
        assertTrue(fileName.matches("[A-Za-z0-9]{16}-cat\\.jpg"), fileName);
    }

    @Test
    void cleanFileName_should_useRandomStem_whenNothingSluggableRemains() {
        String cleaned = namer.cleanFileName("???.png");

        assertTrue(cleaned.matches("[A-Za-z0-9]{10}\\.png"), cleaned);
    }

    @Test
    void cleanFileName_nonLatinName_should_fallBackToRandomStem() {
        String cleaned = namer.cleanFileName("Фотография.jpg");

        assertTrue(cleaned.matches("[A-Za-z0-9]{10}\\.jpg"), cleaned);
        assertNotEquals(cleaned, namer.cleanFileName("Фотография.jpg"));
    }

    @Test
    void cleanFileName_withoutDot_should_haveNoExtension() {
        assertEquals("holiday-snap", namer.cleanFileName("Holiday Snap"));
    }

    @Test
    void cleanFileName_should_slugOnlyBeforeLastDot() {
        assertEquals("archive-v1tar.gz", namer.cleanFileName("archive v1.tar.gz"));
    }

    @Test
    void slugify_should_transliterateAndCollapse() {
        assertEquals("creme-brulee", ImagePathNamer.slugify("Crème  Brûlée"));
        assertEquals("me-at-example-com", ImagePathNamer.slugify("me@example com"));
        assertEquals("snake-case-name", ImagePathNamer.slugify("__snake_case_name__"));
        assertEquals("", ImagePathNamer.slugify("!!!"));
    }

    @Test
    void baseDirectory_should_followClockMonth() {
        assertEquals("uploads/images/system/2024-03", namer.baseDirectory(ImageType.SYSTEM));
    }
}
