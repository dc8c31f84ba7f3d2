/**
 * Threshold alerting over live window statistics.
 *
 * @since 1.0.0
 */
package com.pulsewatch.core.alert;
