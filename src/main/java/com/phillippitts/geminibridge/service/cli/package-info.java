/**
 * Gemini CLI execution: the single-attempt process executor and the conflict retry controller.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code cli.process} - Process launching with timeouts and bounded output capture</li>
 *   <li>{@code cli.conflict} - Sandbox container conflict detection and cleanup</li>
 * </ul>
 */
package com.phillippitts.geminibridge.service.cli;
