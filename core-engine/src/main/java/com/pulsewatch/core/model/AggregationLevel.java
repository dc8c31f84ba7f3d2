package com.pulsewatch.core.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/**
 * Rollup granularity, ordered from finest to coarsest.
 *
 * <p>
 * Bucket boundaries are aligned in UTC: top of minute, top of hour, midnight,
 * Monday midnight (ISO week) and the first day of the month.
 * </p>
 *
 * @since 1.0.0
 */
public enum AggregationLevel {

    MINUTE,
    HOUR,
    DAY,
    WEEK,
    MONTH;

    /**
     * Return the start of the bucket that contains {@code instant}.
     *
     * @param instant any instant
     * @return the inclusive bucket start
     */
    public Instant bucketStart(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        ZonedDateTime start = switch (this) {
            case MINUTE -> t.truncatedTo(ChronoUnit.MINUTES);
            case HOUR -> t.truncatedTo(ChronoUnit.HOURS);
            case DAY -> t.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> t.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
        };
        return start.toInstant();
    }

    /**
     * Return the exclusive end of the bucket starting at {@code bucketStart}.
     *
     * @param bucketStart a value previously returned by {@link #bucketStart(Instant)}
     * @return the start of the following bucket
     */
    public Instant bucketEnd(Instant bucketStart) {
        ZonedDateTime t = bucketStart.atZone(ZoneOffset.UTC);
        ZonedDateTime end = switch (this) {
            case MINUTE -> t.plusMinutes(1);
            case HOUR -> t.plusHours(1);
            case DAY -> t.plusDays(1);
            case WEEK -> t.plusWeeks(1);
            case MONTH -> t.plusMonths(1);
        };
        return end.toInstant();
    }

    /**
     * Return the start of the bucket immediately before the one starting at
     * {@code bucketStart}.
     */
    public Instant previousBucketStart(Instant bucketStart) {
        ZonedDateTime t = bucketStart.atZone(ZoneOffset.UTC);
        ZonedDateTime prev = switch (this) {
            case MINUTE -> t.minusMinutes(1);
            case HOUR -> t.minusHours(1);
            case DAY -> t.minusDays(1);
            case WEEK -> t.minusWeeks(1);
            case MONTH -> t.minusMonths(1);
        };
        return prev.toInstant();
    }
}
