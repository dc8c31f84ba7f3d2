package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.Anomaly;

/**
 * Receives each anomaly the first time it is recorded.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AnomalyListener {

    void onAnomaly(Anomaly anomaly);
}
