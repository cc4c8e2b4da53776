package com.company.outages.domain;

import lombok.Value;

import java.time.Instant;

/**
 * Span during which a link was deliberately out of service. {@code end} is null while still drained.
 */
@Value
public class DrainedPeriod {
    Instant start;
    Instant end;

    public static DrainedPeriod closed(Instant start, Instant end) {
        return new DrainedPeriod(start, end);
    }

    public static DrainedPeriod open(Instant start) {
        return new DrainedPeriod(start, null);
    }

    /**
     * True when {@code [from, to)} intersects this period. An open period is treated as ending at
     * {@code openEnd}.
     */
    public boolean overlaps(Instant from, Instant to, Instant openEnd) {
        Instant periodEnd = end != null ? end : openEnd;
        return from.isBefore(periodEnd) && to.isAfter(start);
    }
}
