package com.github.challengeplatform.submissionengine.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class TextUtil {

    public static final int SCORE_SCALE = 4;

    private static final int MAX_KEY_SEGMENT_LENGTH = 50;

    private static final String DEFAULT_KEY_SEGMENT = "challenge";

    private static final Pattern UNSAFE_KEY_CHARACTERS = Pattern.compile("[^a-z0-9_-]");

    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[_-]+$");

    /**
     * Turns a challenge title into a path segment safe for object storage keys.
     */
    public static String sanitizeForStorageKey(final String title) {
        if (title == null) {
            return DEFAULT_KEY_SEGMENT;
        }

        String sanitized = title.toLowerCase(Locale.ROOT).replace(' ', '_');
        sanitized = UNSAFE_KEY_CHARACTERS.matcher(sanitized).replaceAll("");
        if (sanitized.length() > MAX_KEY_SEGMENT_LENGTH) {
            sanitized = sanitized.substring(0, MAX_KEY_SEGMENT_LENGTH);
        }
        sanitized = TRAILING_SEPARATORS.matcher(sanitized).replaceAll("");

        return sanitized.isEmpty() ? DEFAULT_KEY_SEGMENT : sanitized;
    }

    public static double roundScore(final double score) {
        return BigDecimal.valueOf(score).setScale(SCORE_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }

}
