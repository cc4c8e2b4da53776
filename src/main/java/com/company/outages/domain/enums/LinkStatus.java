package com.company.outages.domain.enums;

public enum LinkStatus {
    ACTIVATED("activated"),
    SOFT_DRAINED("soft-drained"),
    HARD_DRAINED("hard-drained"),
    PENDING("pending"),
    SUSPENDED("suspended"),
    DELETED("deleted"),
    UNKNOWN("unknown");

    private final String code;

    LinkStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isDrained() {
        return this == SOFT_DRAINED || this == HARD_DRAINED;
    }

    public static LinkStatus fromString(String status) {
        if (status == null) {
            return UNKNOWN;
        }
        for (LinkStatus value : values()) {
            if (value.code.equalsIgnoreCase(status.trim())) {
                return value;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
