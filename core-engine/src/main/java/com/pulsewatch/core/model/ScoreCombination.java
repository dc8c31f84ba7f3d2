package com.pulsewatch.core.model;

/**
 * How the scores of agreeing detectors are combined into one deviation score.
 *
 * @since 1.0.0
 */
public enum ScoreCombination {
    MEAN,
    MAX
}
