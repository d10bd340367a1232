package com.phillippitts.geminibridge.service.chat;

import com.phillippitts.geminibridge.presentation.dto.ChatMessage;

import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Renders an OpenAI message list as a single Gemini CLI prompt.
 *
 * <p>Format, one block per message, blocks separated by a blank line:
 * <pre>
 * [System]
 * system message content
 *
 * [User]
 * user message content
 * </pre>
 *
 * <p>Only the most recent {@link #MAX_HISTORY} messages are kept.
 */
public final class PromptBuilder {

    public static final int MAX_HISTORY = 20;

    private PromptBuilder() {
        // Utility class - prevent instantiation
    }

    public static String build(List<ChatMessage> messages) {
        List<ChatMessage> recent = messages.size() > MAX_HISTORY
                ? messages.subList(messages.size() - MAX_HISTORY, messages.size())
                : messages;

        StringJoiner joiner = new StringJoiner("\n");
        for (ChatMessage message : recent) {
            joiner.add("[" + capitalize(message.role()) + "]");
            joiner.add(message.content());
            joiner.add("");
        }
        return joiner.toString().strip();
    }

    private static String capitalize(String role) {
        if (role == null || role.isEmpty()) {
            return "";
        }
        return role.substring(0, 1).toUpperCase(Locale.ROOT) + role.substring(1).toLowerCase(Locale.ROOT);
    }
}
