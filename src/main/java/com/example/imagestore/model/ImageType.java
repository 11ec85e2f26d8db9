package com.example.imagestore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Image categories. The value is the directory name used under {@code uploads/images/}.
 */
public enum ImageType {
    GALLERY("gallery"),
    DRAWIO("drawio"),
    COVER("cover"),
    USER("user"),
    SYSTEM("system");

    private final String value;

    ImageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ImageType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value == null ? null : value.toLowerCase(Locale.ROOT)))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown image type: " + value));
    }
}
