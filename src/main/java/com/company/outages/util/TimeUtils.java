package com.company.outages.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

public class TimeUtils {

    private static final DateTimeFormatter RFC3339_UTC =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    /**
     * Timestamps before this are zero values from the store, not real events
     */
    private static final Instant EARLIEST_PLAUSIBLE = Instant.parse("2000-01-01T00:00:00Z");

    private TimeUtils() {
    }

    /**
     * RFC3339 in UTC with second precision, e.g. 2024-05-01T12:00:00Z.
     * Fixed width so that lexicographic order equals chronological order.
     */
    public static String formatRfc3339(Instant instant) {
        if (instant == null) return null;
        return RFC3339_UTC.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    public static boolean isPlausible(Instant instant) {
        return instant != null && !instant.isBefore(EARLIEST_PLAUSIBLE);
    }

    public static String formatDuration(Long durationSeconds) {
        if (durationSeconds == null) return null;

        long days = durationSeconds / 86400;
        long hours = (durationSeconds % 86400) / 3600;
        long minutes = (durationSeconds % 3600) / 60;
        long seconds = durationSeconds % 60;

        if (days > 0) {
            return String.format("%dd %dh", days, hours);
        } else if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }
}
