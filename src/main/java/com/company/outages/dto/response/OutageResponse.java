package com.company.outages.dto.response;

import com.company.outages.domain.OutageInterval;
import com.company.outages.util.TimeUtils;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutageResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Placeholder start for an ongoing status outage whose originating transition is unknown
     */
    public static final String UNKNOWN_START = "unknown";

    private String id;
    private String linkPk;
    private String linkCode;
    private String linkType;
    private String sideAMetro;
    private String sideZMetro;
    private String contributorCode;
    private String category;

    private String previousStatus;
    private String newStatus;
    private Double thresholdPct;
    private Double peakLossPct;

    private String startedAt;
    private String endedAt;
    private Long durationSeconds;
    private String durationFormatted;

    @JsonProperty("isOngoing")
    private boolean ongoing;

    public static OutageResponse from(OutageInterval interval) {
        return OutageResponse.builder()
                .id(interval.getId())
                .linkPk(interval.getLinkPk())
                .linkCode(interval.getLinkCode())
                .linkType(interval.getLinkType())
                .sideAMetro(interval.getSideAMetro())
                .sideZMetro(interval.getSideZMetro())
                .contributorCode(interval.getContributorCode())
                .category(interval.getCategory().getCode())
                .previousStatus(interval.getPreviousStatus())
                .newStatus(interval.getNewStatus())
                .thresholdPct(interval.getThresholdPct())
                .peakLossPct(interval.getPeakLossPct())
                .startedAt(interval.isStartResolved()
                        ? TimeUtils.formatRfc3339(interval.getStartedAt())
                        : UNKNOWN_START)
                .endedAt(TimeUtils.formatRfc3339(interval.getEndedAt()))
                .durationSeconds(interval.getDurationSeconds())
                .durationFormatted(TimeUtils.formatDuration(interval.getDurationSeconds()))
                .ongoing(interval.isOngoing())
                .build();
    }
}
