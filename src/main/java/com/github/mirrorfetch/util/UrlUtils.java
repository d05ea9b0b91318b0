package com.github.mirrorfetch.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for building mirror URLs.
 */
@UtilityClass
public class UrlUtils {

    /**
     * Join a mirror base URL and a canonical path with exactly one slash.
     *
     * @param baseUrl Mirror base URL, with or without trailing slash
     * @param canonicalPath Catalog path, with or without leading slash
     * @return Full source URL
     */
    public static String resolve(String baseUrl, String canonicalPath) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL must not be blank");
        }
        String base = stripTrailingSlashes(baseUrl.trim());
        if (canonicalPath == null || canonicalPath.isBlank()) {
            return base + "/";
        }
        String path = canonicalPath.trim();
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return base + "/" + path.substring(start);
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }
}
