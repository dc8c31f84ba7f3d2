/**
 * Runnable Pulsewatch process: environment configuration, Kafka transport,
 * HTTP health endpoints and Micrometer instrumentation around the
 * analytics core.
 *
 * @since 1.0.0
 */
package com.pulsewatch.service;
