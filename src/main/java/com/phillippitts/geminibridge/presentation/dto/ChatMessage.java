package com.phillippitts.geminibridge.presentation.dto;

/**
 * One OpenAI chat message. Role and content are checked by the chat request validator rather
 * than bean validation so errors carry the offending message index.
 */
public record ChatMessage(String role, String content) {}
