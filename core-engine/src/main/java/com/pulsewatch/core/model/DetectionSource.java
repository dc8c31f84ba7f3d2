package com.pulsewatch.core.model;

/**
 * Where a detection run reads its series from.
 *
 * @since 1.0.0
 */
public enum DetectionSource {

    /** Raw points from the time-series store. */
    HISTORY,

    /** Points currently held in the live window buffer. */
    LIVE_WINDOW,

    /** Rollups of a given {@link AggregationLevel}. */
    AGGREGATED
}
