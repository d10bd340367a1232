package com.phillippitts.geminibridge.presentation.dto;

/**
 * OpenAI error envelope: {@code {"error": {"message", "type", "code", "param"}}}.
 */
public record OpenAiError(Body error) {

    public static OpenAiError of(String message, String type, String code, String param) {
        return new OpenAiError(new Body(message, type, code, param));
    }

    public record Body(String message, String type, String code, String param) {}
}
