/**
 * Presentation layer (REST API controllers, DTOs and exception handling).
 *
 * <p>This package contains the HTTP boundary of the application, following a
 * 3-tier architecture where presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - OpenAI-compatible endpoints and {@code /health}</li>
 *   <li>{@code presentation.dto} - Request/response records for the OpenAI wire format</li>
 *   <li>{@code presentation.exception} - Maps domain exceptions to OpenAI error bodies</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Controllers are thin adapters - business logic lives in services</li>
 *   <li>Controllers never throw HTTP-specific exceptions (use domain exceptions)</li>
 *   <li>Error bodies never include CLI stderr</li>
 * </ul>
 *
 * @see com.phillippitts.geminibridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.geminibridge.presentation;
