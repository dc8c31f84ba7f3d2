package com.pulsewatch.core.model;

/**
 * Detection method selected by a {@link DetectionRule}.
 *
 * @since 1.0.0
 */
public enum DetectionMethod {

    /** One statistical test, chosen by {@link DetectorParameters#getStatisticalTest()}. */
    STATISTICAL,

    /** Isolation forest over engineered features. */
    ISOLATION_FOREST,

    /** Local outlier factor over engineered features. */
    LOF,

    /** Several detectors combined by vote. */
    ENSEMBLE
}
