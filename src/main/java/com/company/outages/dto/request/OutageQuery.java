package com.company.outages.dto.request;

import com.company.outages.domain.enums.FilterKind;
import com.company.outages.domain.enums.LossThreshold;
import com.company.outages.domain.enums.OutageTypeSelector;
import com.company.outages.domain.enums.TimeRange;
import com.company.outages.exception.InvalidOutageRequestException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated parameters of an outage query
 */
@Value
@Builder
public class OutageQuery {

    @Builder.Default
    TimeRange range = TimeRange.DEFAULT;

    @Builder.Default
    LossThreshold threshold = LossThreshold.DEFAULT;

    @Builder.Default
    OutageTypeSelector type = OutageTypeSelector.DEFAULT;

    @Builder.Default
    List<OutageFilter> filters = List.of();

    public static OutageQuery defaults() {
        return OutageQuery.builder().build();
    }

    /**
     * Validates raw request parameters. Blank parameters take their default.
     *
     * @throws InvalidOutageRequestException on any unknown value
     */
    public static OutageQuery fromParameters(String range, String threshold, String type, String filter) {
        return OutageQuery.builder()
                .range(TimeRange.fromCode(range)
                        .orElseThrow(() -> new InvalidOutageRequestException("range", range,
                                "must be one of 3h, 6h, 12h, 24h, 3d, 7d, 30d")))
                .threshold(LossThreshold.fromCode(threshold)
                        .orElseThrow(() -> new InvalidOutageRequestException("threshold", threshold,
                                "must be 1 or 10")))
                .type(OutageTypeSelector.fromCode(type)
                        .orElseThrow(() -> new InvalidOutageRequestException("type", type,
                                "must be one of all, status, loss, no_data")))
                .filters(List.copyOf(OutageFilter.parseAll(filter)))
                .build();
    }

    public Duration getLookback() {
        return range.getLookback();
    }

    public double getThresholdPct() {
        return threshold.getPercent();
    }

    /**
     * True for exactly the parameter set served from the precomputed snapshot
     */
    public boolean isDefault() {
        return range == TimeRange.DEFAULT
                && threshold == LossThreshold.DEFAULT
                && type == OutageTypeSelector.DEFAULT
                && filters.isEmpty();
    }

    /**
     * Filter values grouped by kind; kinds are ANDed, values of one kind ORed
     */
    public Map<FilterKind, List<String>> getFiltersByKind() {
        Map<FilterKind, Set<String>> grouped = new EnumMap<>(FilterKind.class);
        for (OutageFilter f : filters) {
            grouped.computeIfAbsent(f.getKind(), k -> new LinkedHashSet<>()).add(f.getValue());
        }

        Map<FilterKind, List<String>> result = new EnumMap<>(FilterKind.class);
        grouped.forEach((kind, values) -> result.put(kind, new ArrayList<>(values)));
        return result;
    }
}
