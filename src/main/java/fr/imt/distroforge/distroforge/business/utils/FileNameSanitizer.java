package fr.imt.distroforge.distroforge.business.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class FileNameSanitizer {

    private static final int MAX_LENGTH = 255;

    /**
     * Sanitize a file name to prevent path traversal and header injection.
     */
    public static String sanitize(String fileName) {
        String sanitized = fileName
                .replaceAll("[^a-zA-Z0-9._-]", "_")
                .replaceAll("\\.\\.", "_");
        return sanitized.length() > MAX_LENGTH ? sanitized.substring(0, MAX_LENGTH) : sanitized;
    }
}
