package com.pulsewatch.core.window;

import com.pulsewatch.core.model.MetricPoint;

/**
 * Callback for live points of a subscribed metric name, across all
 * organizations.
 *
 * <p>
 * Invoked on the ingesting thread after the point is buffered. A subscriber
 * that throws is logged and does not affect ingestion or other subscribers.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface MetricSubscriber {

    void onPoint(MetricPoint point);
}
