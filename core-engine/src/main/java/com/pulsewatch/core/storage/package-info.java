/**
 * Durable metric history behind a narrow interface.
 *
 * <p>
 * {@link com.pulsewatch.core.storage.TimeSeriesStore} is the seam external
 * time-series engines plug into;
 * {@link com.pulsewatch.core.storage.InMemoryTimeSeriesStore} is the bundled
 * adapter.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.storage;
