package com.company.outages.domain;

import com.company.outages.domain.enums.LinkStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class StatusTransition {
    String linkPk;
    String linkCode;
    LinkStatus previousStatus;
    LinkStatus newStatus;
    Instant changedAt;

    /**
     * activated -> soft-drained / hard-drained
     */
    public boolean isDrainStart() {
        return previousStatus == LinkStatus.ACTIVATED && newStatus.isDrained();
    }

    /**
     * soft-drained / hard-drained -> activated
     */
    public boolean isRecovery() {
        return newStatus == LinkStatus.ACTIVATED && previousStatus.isDrained();
    }

    /**
     * soft-drained <-> hard-drained
     */
    public boolean isDrainedSubStateChange() {
        return previousStatus.isDrained() && newStatus.isDrained();
    }
}
