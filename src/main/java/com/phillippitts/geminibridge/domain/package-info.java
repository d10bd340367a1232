/**
 * Value types shared across the queue, executor and presentation layers.
 */
package com.phillippitts.geminibridge.domain;
