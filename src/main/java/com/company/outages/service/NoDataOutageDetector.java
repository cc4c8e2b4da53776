package com.company.outages.service;

import com.company.outages.domain.DrainedPeriod;
import com.company.outages.domain.LinkLastSeen;
import com.company.outages.domain.LinkMetadata;
import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.SampleBucket;
import com.company.outages.domain.StatusTransition;
import com.company.outages.domain.enums.OutageCategory;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.repository.LinkCatalogRepository;
import com.company.outages.repository.LinkLatencyRepository;
import com.company.outages.repository.LinkStatusChangeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outages where a link stopped reporting.
 * <p>
 * Gaps explained by a drain are left to {@link StatusOutageDetector}: drained links are never
 * ongoing here, and completed gaps overlapping a drained period are dropped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NoDataOutageDetector implements OutageDetector {

    static final Duration MIN_GAP = Duration.ofMinutes(15);
    static final Duration EXPECTED_CADENCE = Duration.ofMinutes(5);
    static final Duration HISTORY_HORIZON = Duration.ofDays(30);
    static final Duration OPEN_DRAIN_HORIZON = Duration.ofHours(1);

    private final LinkCatalogRepository catalogRepository;
    private final LinkLatencyRepository latencyRepository;
    private final LinkStatusChangeRepository statusChangeRepository;

    @Override
    public OutageCategory getCategory() {
        return OutageCategory.NO_DATA;
    }

    @Override
    public List<OutageInterval> detect(DetectionContext context, OutageQuery query) {
        Map<String, LinkMetadata> links = catalogRepository.findLinks(query.getFiltersByKind());
        context.checkpoint("no data: link catalog");
        if (links.isEmpty()) {
            return List.of();
        }

        Instant windowStart = context.since(query.getLookback());

        List<StatusTransition> transitions = statusChangeRepository.findTransitions(links.keySet(), windowStart);
        Set<String> currentlyDrained = links.values().stream()
                .filter(LinkMetadata::isDrained)
                .map(LinkMetadata::getLinkPk)
                .collect(Collectors.toSet());
        Map<String, List<DrainedPeriod>> drainedPeriods =
                DrainedPeriodTracker.build(transitions, currentlyDrained, windowStart);
        context.checkpoint("no data: drained periods");

        List<OutageInterval> ongoing = findOngoing(context, links);

        Set<String> ongoingLinkCodes = new HashSet<>();
        ongoing.forEach(o -> ongoingLinkCodes.add(o.getLinkCode()));

        List<OutageInterval> completed = findCompleted(context, windowStart, links, drainedPeriods, ongoingLinkCodes);

        log.debug("No-data outages: {} ongoing, {} completed ({} links with drained periods)",
                ongoing.size(), completed.size(), drainedPeriods.size());

        List<OutageInterval> result = new ArrayList<>(ongoing);
        result.addAll(completed);
        return result;
    }

    private List<OutageInterval> findOngoing(DetectionContext context, Map<String, LinkMetadata> links) {
        List<LinkLastSeen> lastSeen = latencyRepository.findLastSeen(links.keySet(), context.since(HISTORY_HORIZON));
        context.checkpoint("no data: last seen");

        Instant silentSince = context.since(MIN_GAP);
        IntervalIdSequence ids = IntervalIdSequence.forOngoing(OutageCategory.NO_DATA);
        List<OutageInterval> ongoing = new ArrayList<>();

        for (LinkLastSeen seen : lastSeen) {
            LinkMetadata link = links.get(seen.getLinkPk());
            if (link == null || link.isDrained() || seen.getLastSeen() == null) {
                continue;
            }
            if (!seen.getLastSeen().isBefore(silentSince)) {
                continue;
            }

            // absence became anomalous one cadence after the last report
            ongoing.add(OutageInterval.forLink(link, OutageCategory.NO_DATA)
                    .id(ids.next())
                    .startedAt(seen.getLastSeen().plus(EXPECTED_CADENCE))
                    .build());
        }
        return ongoing;
    }

    private List<OutageInterval> findCompleted(DetectionContext context, Instant windowStart, Map<String, LinkMetadata> links,
                                               Map<String, List<DrainedPeriod>> drainedPeriods,
                                               Set<String> excludedLinkCodes) {
        List<String> candidatePks = new ArrayList<>();
        links.forEach((pk, link) -> {
            if (!excludedLinkCodes.contains(link.getLinkCode())) {
                candidatePks.add(pk);
            }
        });
        if (candidatePks.isEmpty()) {
            return List.of();
        }

        List<SampleBucket> buckets = latencyRepository.findSampleBuckets(candidatePks, windowStart);
        context.checkpoint("no data: sample buckets");

        Map<String, List<Instant>> byLink = new LinkedHashMap<>();
        for (SampleBucket bucket : buckets) {
            byLink.computeIfAbsent(bucket.getLinkPk(), k -> new ArrayList<>()).add(bucket.getBucketStart());
        }

        Instant openDrainEnd = context.getNow().plus(OPEN_DRAIN_HORIZON);
        IntervalIdSequence ids = IntervalIdSequence.forCompleted(OutageCategory.NO_DATA);
        List<OutageInterval> completed = new ArrayList<>();
        int suppressed = 0;

        for (Map.Entry<String, List<Instant>> entry : byLink.entrySet()) {
            LinkMetadata link = links.get(entry.getKey());
            if (link == null || excludedLinkCodes.contains(link.getLinkCode())) {
                continue;
            }

            List<Instant> reported = entry.getValue();
            reported.sort(Instant::compareTo);
            List<DrainedPeriod> periods = drainedPeriods.getOrDefault(entry.getKey(), List.of());

            for (int i = 1; i < reported.size(); i++) {
                Instant previous = reported.get(i - 1);
                Instant next = reported.get(i);
                if (Duration.between(previous, next).compareTo(MIN_GAP) < 0) {
                    continue;
                }

                Instant gapStart = previous.plus(EXPECTED_CADENCE);
                if (overlapsDrain(gapStart, next, periods, openDrainEnd)) {
                    suppressed++;
                    continue;
                }

                completed.add(OutageInterval.forLink(link, OutageCategory.NO_DATA)
                        .id(ids.next())
                        .startedAt(gapStart)
                        .endedAt(next)
                        .build());
            }
        }

        if (suppressed > 0) {
            log.debug("Suppressed {} reporting gaps explained by drains", suppressed);
        }
        return completed;
    }

    private static boolean overlapsDrain(Instant gapStart, Instant gapEnd, List<DrainedPeriod> periods, Instant openDrainEnd) {
        for (DrainedPeriod period : periods) {
            if (period.overlaps(gapStart, gapEnd, openDrainEnd)) {
                return true;
            }
        }
        return false;
    }
}
