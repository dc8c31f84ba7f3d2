/**
 * Error taxonomy of the analytics core.
 *
 * <ul>
 * <li>{@link com.pulsewatch.core.error.ValidationException}: malformed input,
 * rejected immediately</li>
 * <li>{@link com.pulsewatch.core.error.StorageException}: backend outage,
 * retried with backoff</li>
 * <li>{@link com.pulsewatch.core.error.DetectorException}: a single detector
 * failed, isolated from the ensemble</li>
 * <li>{@link com.pulsewatch.core.error.JobException}: aggregation job failure,
 * retried then surfaced</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.error;
