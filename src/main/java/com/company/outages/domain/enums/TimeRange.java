package com.company.outages.domain.enums;

import java.time.Duration;
import java.util.Optional;

/**
 * Lookback windows accepted by the outage endpoints
 */
public enum TimeRange {
    H3("3h", Duration.ofHours(3)),
    H6("6h", Duration.ofHours(6)),
    H12("12h", Duration.ofHours(12)),
    H24("24h", Duration.ofHours(24)),
    D3("3d", Duration.ofDays(3)),
    D7("7d", Duration.ofDays(7)),
    D30("30d", Duration.ofDays(30));

    public static final TimeRange DEFAULT = H24;

    private final String code;
    private final Duration lookback;

    TimeRange(String code, Duration lookback) {
        this.code = code;
        this.lookback = lookback;
    }

    public String getCode() {
        return code;
    }

    public Duration getLookback() {
        return lookback;
    }

    public static Optional<TimeRange> fromCode(String code) {
        if (code == null || code.isBlank()) {
            return Optional.of(DEFAULT);
        }
        for (TimeRange range : values()) {
            if (range.code.equals(code.trim())) {
                return Optional.of(range);
            }
        }
        return Optional.empty();
    }
}
