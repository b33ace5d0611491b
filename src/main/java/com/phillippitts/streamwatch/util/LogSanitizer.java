package com.phillippitts.streamwatch.util;

import java.net.URI;
import java.net.URISyntaxException;

/** Utility for privacy-safe logging of stream endpoints and engine output. */
public final class LogSanitizer {

    private static final String MASK = "****";

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Masks the stream key (last path segment) and any user-info of a stream URL.
     *
     * <p>{@code rtmp://live.example.com/app/abc123} becomes {@code rtmp://live.example.com/app/****}.
     * Values that do not parse as a URI are fully masked. Returns "" for null.
     */
    public static String redactEndpoint(String endpoint) {
        if (endpoint == null) {
            return "";
        }
        try {
            URI uri = new URI(endpoint.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return MASK;
            }
            StringBuilder sb = new StringBuilder(uri.getScheme()).append("://");
            if (uri.getUserInfo() != null) {
                sb.append(MASK).append('@');
            }
            sb.append(uri.getHost());
            if (uri.getPort() != -1) {
                sb.append(':').append(uri.getPort());
            }
            String path = uri.getPath();
            if (path != null && !path.isEmpty() && !"/".equals(path)) {
                int lastSlash = path.lastIndexOf('/');
                sb.append(path, 0, lastSlash + 1).append(MASK);
            }
            return sb.toString();
        } catch (URISyntaxException e) {
            return MASK;
        }
    }
}
