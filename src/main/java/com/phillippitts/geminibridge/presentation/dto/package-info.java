/**
 * OpenAI-compatible request and response shapes, serialized by Jackson.
 */
package com.phillippitts.geminibridge.presentation.dto;
