package com.company.outages.exception;

import com.company.outages.domain.enums.OutageCategory;
import lombok.Getter;

/**
 * A detector could not read the telemetry store
 */
@Getter
public class OutageDetectionException extends RuntimeException {

    private final OutageCategory category;

    public OutageDetectionException(OutageCategory category, Throwable cause) {
        super("Failed to fetch " + describe(category) + " outages", cause);
        this.category = category;
    }

    private static String describe(OutageCategory category) {
        switch (category) {
            case STATUS:
                return "status";
            case PACKET_LOSS:
                return "packet loss";
            case NO_DATA:
                return "no-data";
            default:
                throw new IllegalArgumentException("Unknown category " + category);
        }
    }
}
