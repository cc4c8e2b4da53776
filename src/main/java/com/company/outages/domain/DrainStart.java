package com.company.outages.domain;

import com.company.outages.domain.enums.LinkStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Most recent activated -> drained transition of a link
 */
@Value
@Builder
public class DrainStart {
    String linkPk;
    LinkStatus previousStatus;
    Instant changedAt;
}
