package com.example.imagestore.service;

import com.example.imagestore.exception.ThumbnailCreationException;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

@Component
public class ThumbnailatorImageResizer implements ImageResizer {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailatorImageResizer.class);
    private static final String FALLBACK_FORMAT = "png";

    @Override
    public byte[] resize(byte[] data, int width, int height, boolean keepRatio) {
        DecodedImage source = decode(data);
        BufferedImage image = source.image();

        Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(image);
        if (keepRatio) {
            int boxWidth = width > 0 ? width : image.getWidth();
            int boxHeight = height > 0 ? height : image.getHeight();
            if (image.getWidth() <= boxWidth && image.getHeight() <= boxHeight) {
                builder.scale(1.0);
            } else {
                builder.size(boxWidth, boxHeight).keepAspectRatio(true);
            }
        } else {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Fit resize needs a positive width and height");
            }
            builder.size(width, height).crop(Positions.CENTER);
        }

        byte[] resized;
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            builder.outputFormat(source.format()).toOutputStream(out);
            resized = out.toByteArray();
        } catch (IOException ex) {
            throw new ThumbnailCreationException("Cannot create thumbnail: failed to encode resized image", ex);
        }

        if (keepRatio && resized.length > data.length) {
            log.debug("Resized image is larger than the source ({} > {} bytes), keeping the source", resized.length, data.length);
            return data;
        }
        return resized;
    }

    private DecodedImage decode(byte[] data) {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new ThumbnailCreationException("Cannot create thumbnail: unsupported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                String format = writableFormat(reader.getFormatName());
                return new DecodedImage(reader.read(0), format);
            } finally {
                reader.dispose();
            }
        } catch (IOException ex) {
            throw new ThumbnailCreationException("Cannot create thumbnail: image data is corrupt", ex);
        }
    }

    private String writableFormat(String formatName) {
        String format = formatName.toLowerCase(Locale.ROOT);
        return ImageIO.getImageWritersByFormatName(format).hasNext() ? format : FALLBACK_FORMAT;
    }

    private record DecodedImage(BufferedImage image, String format) {
    }
}
