package com.example.imagestore.util;

import org.apache.commons.io.FilenameUtils;

import java.util.Locale;

/**
 * Helpers for the slash-separated logical paths used by image storage.
 */
public final class ImagePaths {

    public static final String IMAGES_ROOT = "uploads/images";

    private ImagePaths() {
    }

    public static String directory(String path) {
        return FilenameUtils.getFullPathNoEndSeparator(path);
    }

    public static String fileName(String path) {
        return FilenameUtils.getName(path);
    }

    /**
     * Lower-cased extension, for format sniffing only.
     */
    public static String extension(String path) {
        return FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT);
    }

    public static String join(String directory, String name) {
        return trimSlashes(directory) + "/" + trimSlashes(name);
    }

    public static String trimSlashes(String value) {
        return value.replaceAll("^/+", "").replaceAll("/+$", "");
    }
}
