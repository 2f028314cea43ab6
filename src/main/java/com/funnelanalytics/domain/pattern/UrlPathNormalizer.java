package com.funnelanalytics.domain.pattern;

import java.util.regex.Pattern;

/**
 * Canonical form of a tracked URL path.
 *
 * Drops query string and fragment, collapses repeated slashes and trailing slashes.
 * An empty result becomes {@code "/"}. Applying it twice gives the same result as once.
 */
public final class UrlPathNormalizer {

    public static final String ROOT = "/";

    private static final Pattern QUERY_OR_FRAGMENT = Pattern.compile("[?#].*", Pattern.DOTALL);
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/{2,}");

    private UrlPathNormalizer() {
    }

    public static String normalize(String rawPath) {
        if (rawPath == null) {
            return ROOT;
        }
        String path = QUERY_OR_FRAGMENT.matcher(rawPath).replaceFirst("");
        path = REPEATED_SLASHES.matcher(path).replaceAll("/");

        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        path = path.substring(0, end);

        return path.isEmpty() ? ROOT : path;
    }
}
