/**
 * REST controllers: the OpenAI-compatible endpoints and the queue health endpoint.
 */
package com.phillippitts.geminibridge.presentation.controller;
