/**
 * Request-scoped logging context.
 *
 * <p>{@link com.phillippitts.geminibridge.config.logging.MdcFilter} runs first in the filter
 * chain so every later log line, including those written on the CLI worker pool, carries the
 * request id.
 */
package com.phillippitts.geminibridge.config.logging;
