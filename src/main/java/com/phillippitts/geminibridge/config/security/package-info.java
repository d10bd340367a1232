/**
 * HTTP security middleware: bearer token authentication and per-client rate limiting.
 *
 * <p>Both filters answer rejections themselves with OpenAI error bodies, since servlet filters
 * run before {@code @ControllerAdvice}. {@code /health} is exempt from both.
 */
package com.phillippitts.geminibridge.config.security;
