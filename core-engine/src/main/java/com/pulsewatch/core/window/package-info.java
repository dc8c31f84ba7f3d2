/**
 * Live ingestion, bounded per-key buffers and sliding-window statistics.
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.window;
