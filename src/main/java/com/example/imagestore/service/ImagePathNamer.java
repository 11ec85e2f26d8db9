package com.example.imagestore.service;

import com.example.imagestore.config.ImageProperties;
import com.example.imagestore.model.ImageType;
import com.example.imagestore.util.ImagePaths;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.text.Normalizer;
import java.time.Clock;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Builds storage paths for new source images:
 * {@code uploads/images/<type>/<yyyy-MM>/[token-]<slug>.<ext>}.
 */
@Component
public class ImagePathNamer {

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int RANDOM_STEM_LENGTH = 10;
    private static final int COLLISION_PREFIX_LENGTH = 3;
    private static final int SECURE_TOKEN_LENGTH = 16;

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^-a-z0-9\\s]+");
    private static final Pattern SEPARATOR_RUNS = Pattern.compile("[-\\s]+");

    private final ImageProperties properties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public ImagePathNamer(ImageProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param pathTaken answers whether a candidate path is already taken in the target storage
     */
    public String newSourcePath(String originalName, ImageType type, Predicate<String> pathTaken) {
        String directory = baseDirectory(type);
        String fileName = cleanFileName(originalName);

        while (pathTaken.test(ImagePaths.join(directory, fileName))) {
            fileName = randomAlphanumeric(COLLISION_PREFIX_LENGTH) + fileName;
        }

        if (properties.isSecureUploads()) {
            return ImagePaths.join(directory, randomAlphanumeric(SECURE_TOKEN_LENGTH) + "-" + fileName);
        }
        return ImagePaths.join(directory, fileName);
    }

    public String baseDirectory(ImageType type) {
        return ImagePaths.IMAGES_ROOT + "/" + type.getValue() + "/" + YearMonth.now(clock).format(MONTH_FORMAT);
    }

    /**
     * Slugs the part before the last dot and keeps the extension as given.
     */
    String cleanFileName(String name) {
        String hyphenated = (name == null ? "" : name).replace(' ', '-');
        int dot = hyphenated.lastIndexOf('.');
        String stem = dot < 0 ? hyphenated : hyphenated.substring(0, dot);
        String extension = dot < 0 ? "" : hyphenated.substring(dot + 1);

        String slug = slugify(stem);
        if (slug.isEmpty()) {
            slug = randomAlphanumeric(RANDOM_STEM_LENGTH);
        }
        return extension.isEmpty() ? slug : slug + "." + extension;
    }

    static String slugify(String value) {
        String ascii = COMBINING_MARKS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
        ascii = ascii.replace('_', '-').replace("@", "-at-").toLowerCase(Locale.ROOT);
        ascii = NON_SLUG_CHARS.matcher(ascii).replaceAll("");
        ascii = SEPARATOR_RUNS.matcher(ascii).replaceAll("-");
        return ascii.replaceAll("^-+", "").replaceAll("-+$", "");
    }

    private String randomAlphanumeric(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(ALPHANUMERIC.charAt(secureRandom.nextInt(ALPHANUMERIC.length())));
        }
        return builder.toString();
    }
}
