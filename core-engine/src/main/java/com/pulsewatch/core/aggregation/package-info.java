/**
 * Scheduled multi-level rollups of raw metric points.
 *
 * <p>
 * {@link com.pulsewatch.core.aggregation.AggregationPipeline} turns each
 * enabled {@link com.pulsewatch.core.model.AggregationRule} into per-bucket
 * {@link com.pulsewatch.core.aggregation.AggregationJob}s run on a bounded
 * worker pool.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.aggregation;
