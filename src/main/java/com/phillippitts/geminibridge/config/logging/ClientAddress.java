package com.phillippitts.geminibridge.config.logging;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves the originating client address, honoring a reverse proxy's X-Forwarded-For header.
 */
public final class ClientAddress {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private ClientAddress() {
        // Utility class - prevent instantiation
    }

    /**
     * @return first X-Forwarded-For entry, else the remote address, else {@code "unknown"}
     */
    public static String of(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",")[0].strip();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? "unknown" : remote;
    }
}
