package com.company.outages.domain;

import com.company.outages.domain.enums.OutageCategory;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * One reconstructed outage on a link.
 * <p>
 * Link metadata is a snapshot taken from the dimension catalog at detection time.
 * {@code startedAt} is null only for an ongoing status outage whose originating
 * transition could not be found. {@code endedAt} is null iff the outage is ongoing.
 */
@Value
@Builder(toBuilder = true)
public class OutageInterval {

    String id;

    String linkPk;
    String linkCode;
    String linkType;
    String sideAMetro;
    String sideZMetro;
    String contributorCode;

    OutageCategory category;

    // STATUS only
    String previousStatus;
    String newStatus;

    // PACKET_LOSS only
    Double thresholdPct;
    Double peakLossPct;

    Instant startedAt;
    Instant endedAt;

    /**
     * Builder pre-filled with the link's catalog metadata
     */
    public static OutageIntervalBuilder forLink(LinkMetadata link, OutageCategory category) {
        return OutageInterval.builder()
                .linkPk(link.getLinkPk())
                .linkCode(link.getLinkCode())
                .linkType(link.getLinkType())
                .sideAMetro(link.getSideAMetro())
                .sideZMetro(link.getSideZMetro())
                .contributorCode(link.getContributorCode())
                .category(category);
    }

    public boolean isOngoing() {
        return endedAt == null;
    }

    public boolean isStartResolved() {
        return startedAt != null;
    }

    /**
     * Whole seconds between start and end, null while ongoing
     */
    public Long getDurationSeconds() {
        if (endedAt == null || startedAt == null) {
            return null;
        }
        return Duration.between(startedAt, endedAt).getSeconds();
    }
}
