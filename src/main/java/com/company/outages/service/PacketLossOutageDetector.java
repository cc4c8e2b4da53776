package com.company.outages.service;

import com.company.outages.domain.LinkMetadata;
import com.company.outages.domain.LossBucket;
import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.RecentLoss;
import com.company.outages.domain.enums.OutageCategory;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.repository.LinkCatalogRepository;
import com.company.outages.repository.LinkLatencyRepository;
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
import java.util.Optional;
import java.util.Set;

/**
 * Packet loss outages.
 * <p>
 * A link is in an ongoing loss outage when its loss over the last 10 minutes is at or above the
 * threshold; its start and peak come from a back-scan of up to 30 days of 5-minute buckets.
 * Completed outages are threshold crossings of the bucketed lookback of every other link.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PacketLossOutageDetector implements OutageDetector {

    static final Duration RECENT_WINDOW = Duration.ofMinutes(10);
    static final Duration BACK_SCAN_HORIZON = Duration.ofDays(30);
    static final int MIN_SAMPLES = 3;

    private final LinkCatalogRepository catalogRepository;
    private final LinkLatencyRepository latencyRepository;

    @Override
    public OutageCategory getCategory() {
        return OutageCategory.PACKET_LOSS;
    }

    @Override
    public List<OutageInterval> detect(DetectionContext context, OutageQuery query) {
        Map<String, LinkMetadata> links = catalogRepository.findLinks(query.getFiltersByKind());
        context.checkpoint("packet loss: link catalog");
        if (links.isEmpty()) {
            return List.of();
        }

        double threshold = query.getThresholdPct();

        List<OutageInterval> ongoing = findOngoing(context, links, threshold);

        Set<String> ongoingLinkCodes = new HashSet<>();
        ongoing.forEach(o -> ongoingLinkCodes.add(o.getLinkCode()));

        List<OutageInterval> completed = findCompleted(context, query, links, threshold, ongoingLinkCodes);

        log.debug("Packet loss outages (threshold {}%): {} ongoing, {} completed",
                threshold, ongoing.size(), completed.size());

        List<OutageInterval> result = new ArrayList<>(ongoing);
        result.addAll(completed);
        return result;
    }

    private List<OutageInterval> findOngoing(DetectionContext context, Map<String, LinkMetadata> links, double threshold) {
        Instant recentSince = context.since(RECENT_WINDOW);
        List<RecentLoss> recent = latencyRepository.findRecentLoss(links.keySet(), recentSince, MIN_SAMPLES);
        context.checkpoint("packet loss: recent window");

        IntervalIdSequence ids = IntervalIdSequence.forOngoing(OutageCategory.PACKET_LOSS);
        List<OutageInterval> ongoing = new ArrayList<>();

        for (RecentLoss loss : recent) {
            LinkMetadata link = links.get(loss.getLinkPk());
            if (link == null || loss.getLossPct() < threshold) {
                continue;
            }

            List<LossBucket> history = latencyRepository.findLossHistory(
                    loss.getLinkPk(), context.since(BACK_SCAN_HORIZON), MIN_SAMPLES);
            context.checkpoint("packet loss: back-scan of " + link.getLinkCode());

            Optional<LossEpisode> episode = LossThresholdEdgeDetector.findOngoingStart(history, threshold, recentSince);

            Instant startedAt;
            double peak;
            if (episode.isPresent()) {
                startedAt = episode.get().getStart();
                peak = episode.get().getPeakLossPct();
            } else {
                log.debug("No bucket at or above {}% in history of {}, starting at recent window",
                        threshold, link.getLinkCode());
                Instant lastSeen = loss.getLastSeen() != null ? loss.getLastSeen() : context.getNow();
                startedAt = lastSeen.minus(RECENT_WINDOW);
                peak = loss.getLossPct();
            }

            ongoing.add(OutageInterval.forLink(link, OutageCategory.PACKET_LOSS)
                    .id(ids.next())
                    .thresholdPct(threshold)
                    .peakLossPct(peak)
                    .startedAt(startedAt)
                    .build());
        }
        return ongoing;
    }

    private List<OutageInterval> findCompleted(DetectionContext context, OutageQuery query, Map<String, LinkMetadata> links,
                                               double threshold, Set<String> excludedLinkCodes) {
        List<String> candidatePks = new ArrayList<>();
        links.forEach((pk, link) -> {
            if (!excludedLinkCodes.contains(link.getLinkCode())) {
                candidatePks.add(pk);
            }
        });
        if (candidatePks.isEmpty()) {
            return List.of();
        }

        List<LossBucket> buckets = latencyRepository.findLossBuckets(
                candidatePks, context.since(query.getLookback()), MIN_SAMPLES);
        context.checkpoint("packet loss: lookback buckets");

        Map<String, List<LossBucket>> byLink = new LinkedHashMap<>();
        for (LossBucket bucket : buckets) {
            byLink.computeIfAbsent(bucket.getLinkPk(), k -> new ArrayList<>()).add(bucket);
        }

        IntervalIdSequence ids = IntervalIdSequence.forCompleted(OutageCategory.PACKET_LOSS);
        List<OutageInterval> completed = new ArrayList<>();

        byLink.forEach((linkPk, linkBuckets) -> {
            LinkMetadata link = links.get(linkPk);
            if (link == null || excludedLinkCodes.contains(link.getLinkCode())) {
                return;
            }
            for (LossEpisode episode : LossThresholdEdgeDetector.detect(linkBuckets, threshold)) {
                completed.add(OutageInterval.forLink(link, OutageCategory.PACKET_LOSS)
                        .id(ids.next())
                        .thresholdPct(threshold)
                        .peakLossPct(episode.getPeakLossPct())
                        .startedAt(episode.getStart())
                        .endedAt(episode.getEnd())
                        .build());
            }
        });
        return completed;
    }
}
