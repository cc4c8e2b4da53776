package com.company.outages.domain;

import lombok.Value;

import java.time.Instant;

/**
 * A bucket in which a link reported at least one sample
 */
@Value
public class SampleBucket {
    String linkPk;
    Instant bucketStart;
}
