package com.company.outages.domain.enums;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Value of the {@code type} request parameter; selects which detectors run
 */
public enum OutageTypeSelector {
    ALL("all", EnumSet.allOf(OutageCategory.class)),
    STATUS("status", EnumSet.of(OutageCategory.STATUS)),
    LOSS("loss", EnumSet.of(OutageCategory.PACKET_LOSS)),
    NO_DATA("no_data", EnumSet.of(OutageCategory.NO_DATA));

    public static final OutageTypeSelector DEFAULT = ALL;

    private final String code;
    private final Set<OutageCategory> categories;

    OutageTypeSelector(String code, Set<OutageCategory> categories) {
        this.code = code;
        this.categories = categories;
    }

    public String getCode() {
        return code;
    }

    public boolean includes(OutageCategory category) {
        return categories.contains(category);
    }

    public static Optional<OutageTypeSelector> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.of(DEFAULT);
        }
        for (OutageTypeSelector selector : values()) {
            if (selector.code.equals(code.trim())) {
                return Optional.of(selector);
            }
        }
        return Optional.empty();
    }
}
