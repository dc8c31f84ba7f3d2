/**
 * Shared helpers: descriptive statistics, retry with exponential backoff and
 * worker thread naming.
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.util;
