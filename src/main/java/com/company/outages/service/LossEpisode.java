package com.company.outages.service;

import lombok.Value;

import java.time.Instant;

/**
 * A run of consecutive at-or-above-threshold loss buckets. {@code end} is null for a run that is
 * still going on.
 */
@Value
class LossEpisode {
    Instant start;
    Instant end;
    double peakLossPct;
}
