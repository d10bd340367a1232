package com.phillippitts.geminibridge.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Utility for privacy-safe logging of tokens, client addresses and prompt/response text.
 *
 * <p>Nothing passed through these helpers should be reversible to the original secret or
 * conversation content; they exist so log lines stay useful for correlation only.
 */
public final class LogSanitizer {

    private static final String MASK = "***";
    private static final double CONTENT_MASK_RATIO = 0.65;

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
     * Masks a bearer token, keeping the first and last {@code showChars} characters.
     *
     * @param token token to mask (null yields {@code "***"})
     * @param showChars characters to keep at each end
     * @return masked token such as {@code abcd***wxyz}
     */
    public static String maskToken(String token, int showChars) {
        if (token == null || showChars <= 0 || token.length() <= showChars * 2) {
            return MASK;
        }
        return token.substring(0, showChars) + MASK + token.substring(token.length() - showChars);
    }

    /**
     * Masks the last octet of an IPv4 address. Other formats are returned unchanged.
     */
    public static String maskIp(String ip) {
        if (ip == null) {
            return "";
        }
        String[] parts = ip.split("\\.");
        if (parts.length == 4) {
            return parts[0] + "." + parts[1] + "." + parts[2] + "." + MASK;
        }
        return ip;
    }

    /**
     * Produces a log preview of prompt or response text: truncated to {@code maxLength} and with
     * roughly two thirds of the characters replaced by {@code '*'} at random.
     *
     * @param content text to mask (null yields "")
     * @param maxLength maximum preview length before an ellipsis is appended
     * @return masked preview
     */
    public static String maskContent(String content, int maxLength) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String truncated = truncate(content, maxLength);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(truncated.length() + 3);
        for (int i = 0; i < truncated.length(); i++) {
            sb.append(random.nextDouble() < CONTENT_MASK_RATIO ? '*' : truncated.charAt(i));
        }
        if (content.length() > truncated.length()) {
            sb.append("...");
        }
        return sb.toString();
    }
}
