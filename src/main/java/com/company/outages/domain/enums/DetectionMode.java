package com.company.outages.domain.enums;

public enum DetectionMode {
    /**
     * First detector failure fails the whole request (live endpoint)
     */
    STRICT,

    /**
     * A failing category contributes no intervals, the others are still returned (snapshot refresh)
     */
    DEGRADED
}
