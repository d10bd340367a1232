package com.phillippitts.geminibridge.exception;

/**
 * Thrown when a chat completion request fails structural or size validation.
 */
public class InvalidChatRequestException extends GeminiBridgeException {

    private final String param;

    public InvalidChatRequestException(String message) {
        this(message, "messages");
    }

    public InvalidChatRequestException(String message, String param) {
        super(message);
        this.param = param;
    }

    /**
     * Returns the request parameter the error refers to, reported back in the OpenAI error body.
     */
    public String getParam() {
        return param;
    }
}
