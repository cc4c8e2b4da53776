package com.company.outages.domain.enums;

import java.util.Optional;

public enum LossThreshold {
    ONE_PERCENT("1", 1.0),
    TEN_PERCENT("10", 10.0);

    public static final LossThreshold DEFAULT = ONE_PERCENT;

    private final String code;
    private final double percent;

    LossThreshold(String code, double percent) {
        this.code = code;
        this.percent = percent;
    }

    public String getCode() {
        return code;
    }

    public double getPercent() {
        return percent;
    }

    public static Optional<LossThreshold> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.of(DEFAULT);
        }
        for (LossThreshold threshold : values()) {
            if (threshold.code.equals(code.trim())) {
                return Optional.of(threshold);
            }
        }
        return Optional.empty();
    }
}
