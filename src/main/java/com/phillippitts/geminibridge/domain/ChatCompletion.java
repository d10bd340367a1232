package com.phillippitts.geminibridge.domain;

/**
 * A finished chat completion, ready to be rendered as an OpenAI response or stream.
 *
 * @param id OpenAI completion id ({@code chatcmpl-<requestId>})
 * @param created epoch seconds
 * @param requestedModel model name as the client sent it (echoed back)
 * @param resolvedModel Gemini model actually used
 * @param content assistant reply
 */
public record ChatCompletion(
        String id,
        long created,
        String requestedModel,
        String resolvedModel,
        String content
) {}
