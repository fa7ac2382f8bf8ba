package com.skillq.spi;

import java.util.regex.Pattern;

/**
 * Strips control characters and truncates to a fixed length.
 */
public class PlainTextSanitizer implements ContentSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\r\\n\\t]]");

    private final int maxLength;

    public PlainTextSanitizer(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0");
        }
        this.maxLength = maxLength;
    }

    @Override
    public String sanitize(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("").trim();
        if (cleaned.length() <= maxLength) {
            return cleaned;
        }
        return cleaned.substring(0, maxLength);
    }
}
