package io.artifacttracker.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Utility to build resource URLs and query strings with repeatable parameters.
 */
public final class Urls {
    private Urls() {}

    /**
     * Joins a base URL and path segments with {@code /}. A trailing slash on the base is dropped.
     * Segments are appended verbatim.
     *
     * @throws IllegalArgumentException if the result is not a valid URI
     */
    public static URI resource(String baseUrl, String... segments) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        StringBuilder sb = new StringBuilder(stripTrailingSlash(baseUrl));
        for (String segment : segments) {
            sb.append('/').append(Objects.requireNonNull(segment, "segment"));
        }
        return URI.create(sb.toString());
    }

    /**
     * Appends query parameters to {@code base}. Each entry contributes one {@code key=value} pair,
     * so a key may repeat. Keys and values are form-encoded.
     */
    public static URI withQuery(URI base, List<Map.Entry<String, String>> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getRawQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : params) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
