/**
 * Spring configuration: property binding, bean wiring, thread pools, metrics and HTTP middleware.
 */
package com.phillippitts.geminibridge.config;
