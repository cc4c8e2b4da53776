package com.company.outages.service;

import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.enums.OutageCategory;
import com.company.outages.dto.response.LinkOutagesResponse;
import com.company.outages.dto.response.OutageResponse;
import com.company.outages.dto.response.OutageSummary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Merges the per-category interval lists into one response, most recent start first.
 * Starts that could not be resolved sort ahead of everything else.
 */
@Component
public class OutageAggregator {

    static final Comparator<OutageInterval> MOST_RECENT_FIRST = Comparator.comparing(
            OutageInterval::getStartedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .reversed();

    public LinkOutagesResponse aggregate(Collection<List<OutageInterval>> perCategory) {
        List<OutageInterval> merged = new ArrayList<>();
        perCategory.forEach(merged::addAll);
        merged.sort(MOST_RECENT_FIRST);

        List<OutageResponse> outages = merged.stream()
                .map(OutageResponse::from)
                .collect(Collectors.toList());

        return LinkOutagesResponse.builder()
                .outages(outages)
                .summary(summarize(merged))
                .build();
    }

    static OutageSummary summarize(List<OutageInterval> intervals) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (OutageCategory category : OutageCategory.values()) {
            byType.put(category.getCode(), 0);
        }

        int ongoing = 0;
        for (OutageInterval interval : intervals) {
            if (interval.isOngoing()) {
                ongoing++;
            }
            byType.merge(interval.getCategory().getCode(), 1, Integer::sum);
        }

        return OutageSummary.builder()
                .total(intervals.size())
                .ongoing(ongoing)
                .byType(byType)
                .build();
    }
}
