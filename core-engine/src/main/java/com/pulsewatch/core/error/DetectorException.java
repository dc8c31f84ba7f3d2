package com.pulsewatch.core.error;

/**
 * Raised when a single detector cannot process its input series.
 *
 * <p>
 * The ensemble excludes the failing detector from the current vote and carries
 * on with the remaining detectors.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String detectorName;

    public DetectorException(String detectorName, String message) {
        super("[" + detectorName + "] " + message);
        this.detectorName = detectorName;
    }

    public DetectorException(String detectorName, String message, Throwable cause) {
        super("[" + detectorName + "] " + message, cause);
        this.detectorName = detectorName;
    }

    public String getDetectorName() {
        return detectorName;
    }
}
