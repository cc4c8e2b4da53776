package com.company.outages.domain;

import com.company.outages.domain.enums.LinkStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Link row from the dimension catalog, joined with its metros and contributor
 */
@Value
@Builder
public class LinkMetadata {
    String linkPk;
    String linkCode;
    String linkType;
    String sideAMetro;
    String sideZMetro;
    String contributorCode;
    LinkStatus status;

    public boolean isDrained() {
        return status != null && status.isDrained();
    }
}
