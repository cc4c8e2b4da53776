package com.company.outages.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Loss ratio of one link over the short recent window
 */
@Value
@Builder
public class RecentLoss {
    String linkPk;
    double lossPct;
    long sampleCount;
    Instant lastSeen;
}
