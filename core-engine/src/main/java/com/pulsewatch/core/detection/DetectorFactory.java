package com.pulsewatch.core.detection;

import com.pulsewatch.core.model.DetectionMethod;
import com.pulsewatch.core.model.DetectorKind;
import com.pulsewatch.core.model.DetectorParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AnomalyDetector} instances and voting
 * ensembles from typed detector parameters.
 *
 * <p>
 * This is the single point of extension when adding new detector kinds: add
 * the constant to {@link DetectorKind} and create the corresponding detector
 * here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class — not instantiable
    }

    /**
     * Create a detector of the given kind.
     *
     * @param kind   detector kind; must not be {@code null}
     * @param params tuning parameters; must not be {@code null}
     * @return a new detector
     */
    public static AnomalyDetector create(DetectorKind kind, DetectorParameters params) {
        Objects.requireNonNull(kind, "DetectorKind must not be null");
        Objects.requireNonNull(params, "DetectorParameters must not be null");

        return switch (kind) {
            case ZSCORE -> new ZScoreDetector(params.getSensitivity(), params.getMinDataPoints());
            case IQR -> new IqrDetector(params.getIqrMultiplier(), params.getMinDataPoints());
            case MODIFIED_ZSCORE -> new ModifiedZScoreDetector(params.getModifiedZThreshold(),
                    params.getMinDataPoints());
            case ISOLATION_FOREST -> new IsolationForestDetector(params.getTrees(), params.getSampleSize(),
                    params.getSeed(), params.getContamination(), params.getIsolationThreshold(),
                    params.getFeatureWindow(), params.getMinDataPoints(), params.getMaxModelPoints());
            case LOCAL_OUTLIER_FACTOR -> new LocalOutlierFactorDetector(params.getNeighbors(),
                    params.getContamination(), params.getLofThreshold(), params.getFeatureWindow(),
                    params.getMinDataPoints(), params.getMaxModelPoints());
            case TREND_SHIFT -> new TrendShiftDetector(params.getTrendWindow(), params.getMinTrendShift(),
                    params.getMinDataPoints());
        };
    }

    /**
     * Build the voter a detection method runs.
     *
     * <ul>
     * <li>{@code STATISTICAL}: the configured statistical test alone</li>
     * <li>{@code ISOLATION_FOREST} / {@code LOF}: that model alone</li>
     * <li>{@code ENSEMBLE}: the configured detector subset with the configured
     * voting threshold</li>
     * </ul>
     *
     * @param method detection method; must not be {@code null}
     * @param params tuning parameters; must not be {@code null}
     * @return a voter for the method
     */
    public static EnsembleVoter forMethod(DetectionMethod method, DetectorParameters params) {
        Objects.requireNonNull(method, "DetectionMethod must not be null");
        Objects.requireNonNull(params, "DetectorParameters must not be null");

        List<DetectorKind> kinds = switch (method) {
            case STATISTICAL -> List.of(params.getStatisticalTest());
            case ISOLATION_FOREST -> List.of(DetectorKind.ISOLATION_FOREST);
            case LOF -> List.of(DetectorKind.LOCAL_OUTLIER_FACTOR);
            case ENSEMBLE -> params.getDetectors();
        };
        int threshold = method == DetectionMethod.ENSEMBLE ? params.getVotingThreshold() : 1;
        List<AnomalyDetector> detectors = kinds.stream()
                .map(k -> create(k, params))
                .toList();
        LOG.debug("Built {} voter over {} (threshold {})", method, kinds, threshold);
        return new EnsembleVoter(detectors, threshold, params.getScoreCombination());
    }
}
