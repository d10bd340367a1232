/**
 * Translates domain exceptions into OpenAI error responses.
 */
package com.phillippitts.geminibridge.presentation.exception;
