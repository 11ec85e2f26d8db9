package com.example.imagestore.service;

/**
 * Resizes encoded image bytes.
 */
public interface ImageResizer {

    /**
     * @param keepRatio {@code true} to fit inside the box without upscaling (a non-positive dimension leaves
     *                  that side unconstrained), {@code false} to scale and crop to exactly {@code width x height}
     * @throws com.example.imagestore.exception.ThumbnailCreationException when the bytes cannot be decoded
     */
    byte[] resize(byte[] data, int width, int height, boolean keepRatio);
}
