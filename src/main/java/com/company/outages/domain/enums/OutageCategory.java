package com.company.outages.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutageCategory {
    STATUS("status", "status"),
    PACKET_LOSS("packet_loss", "loss"),
    NO_DATA("no_data", "nodata");

    private final String code;
    private final String idPrefix;

    OutageCategory(String code, String idPrefix) {
        this.code = code;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Prefix of the request-local interval ids, e.g. {@code loss-1001}
     */
    public String getIdPrefix() {
        return idPrefix;
    }

    @Override
    public String toString() {
        return code;
    }
}
