package com.company.outages.domain.enums;

import java.util.Optional;

public enum FilterKind {
    METRO("metro"),
    LINK("link"),
    CONTRIBUTOR("contributor"),
    DEVICE("device");

    private final String code;

    FilterKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<FilterKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (FilterKind kind : values()) {
            if (kind.code.equals(code.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
