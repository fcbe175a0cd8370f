package com.eidos.core.model;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Generates the opaque 12-hex-character identifiers used by every model type.
 * An id is the MD5 of a short content fingerprint plus the construction timestamp.
 */
public final class ContentIds {

    private static final int ID_LENGTH = 12;

    private ContentIds() {}

    public static String generate(String fingerprint, double timestamp) {
        String key = fingerprint + ":" + timestamp;
        return DigestUtils.md5DigestAsHex(key.getBytes(StandardCharsets.UTF_8)).substring(0, ID_LENGTH);
    }

    public static String prefix(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /** Epoch seconds with millisecond precision, the timestamp unit stored in every table. */
    public static double now() {
        return System.currentTimeMillis() / 1000.0;
    }
}
