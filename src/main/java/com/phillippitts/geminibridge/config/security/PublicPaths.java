package com.phillippitts.geminibridge.config.security;

/**
 * Paths that bypass authentication and rate limiting.
 */
final class PublicPaths {

    private PublicPaths() {
        // Utility class - prevent instantiation
    }

    static boolean isPublic(String uri) {
        if (uri == null) {
            return false;
        }
        return "/health".equals(uri) || "/actuator/health".equals(uri) || uri.startsWith("/actuator/health/");
    }
}
