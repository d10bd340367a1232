package com.phillippitts.geminibridge.service.chat;

import com.phillippitts.geminibridge.exception.InvalidChatRequestException;
import com.phillippitts.geminibridge.presentation.dto.ChatMessage;

import java.util.List;
import java.util.Set;

/**
 * Structural and size checks for chat completion messages.
 */
public final class ChatRequestValidator {

    public static final int MAX_MESSAGES = 100;
    public static final int MAX_CONTENT_CHARS = 100_000;

    private static final Set<String> VALID_ROLES = Set.of("system", "user", "assistant");

    private ChatRequestValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * @throws InvalidChatRequestException on the first violation found
     */
    public static void validate(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new InvalidChatRequestException("Messages array cannot be empty");
        }
        if (messages.size() > MAX_MESSAGES) {
            throw new InvalidChatRequestException(
                    "Too many messages. Maximum " + MAX_MESSAGES + " messages allowed.");
        }
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            if (message == null || message.role() == null || message.content() == null) {
                throw new InvalidChatRequestException(
                        "Message at index " + i + " missing required fields (role, content)");
            }
            if (!VALID_ROLES.contains(message.role())) {
                throw new InvalidChatRequestException(
                        "Message at index " + i + " has invalid role: " + message.role());
            }
            if (message.content().length() > MAX_CONTENT_CHARS) {
                throw new InvalidChatRequestException(
                        "Message content too long. Maximum 100,000 characters per message.");
            }
        }
    }
}
