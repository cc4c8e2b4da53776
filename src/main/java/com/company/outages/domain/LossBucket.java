package com.company.outages.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Packet loss aggregated over one fixed-width bucket
 */
@Value
@Builder
public class LossBucket {

    public static final Duration WIDTH = Duration.ofMinutes(5);

    String linkPk;
    Instant bucketStart;
    double lossPct;
    long sampleCount;

    public Instant getBucketEnd() {
        return bucketStart.plus(WIDTH);
    }

    public boolean isAtOrAbove(double thresholdPct) {
        return lossPct >= thresholdPct;
    }
}
