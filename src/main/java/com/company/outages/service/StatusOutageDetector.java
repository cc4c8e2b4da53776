package com.company.outages.service;

import com.company.outages.domain.DrainStart;
import com.company.outages.domain.LinkMetadata;
import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.StatusTransition;
import com.company.outages.domain.enums.LinkStatus;
import com.company.outages.domain.enums.OutageCategory;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.repository.LinkCatalogRepository;
import com.company.outages.repository.LinkStatusChangeRepository;
import com.company.outages.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Drain outages.
 * <p>
 * Ongoing drains come from the links' current status, whatever the lookback. Completed drains are
 * paired from the transition log inside the lookback, skipping links that are drained right now.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StatusOutageDetector implements OutageDetector {

    private final LinkCatalogRepository catalogRepository;
    private final LinkStatusChangeRepository statusChangeRepository;

    @Override
    public OutageCategory getCategory() {
        return OutageCategory.STATUS;
    }

    @Override
    public List<OutageInterval> detect(DetectionContext context, OutageQuery query) {
        Map<String, LinkMetadata> links = catalogRepository.findLinks(query.getFiltersByKind());
        context.checkpoint("status: link catalog");

        List<OutageInterval> ongoing = findOngoing(links);
        context.checkpoint("status: ongoing drains");

        Set<String> ongoingLinkCodes = ongoing.stream()
                .map(OutageInterval::getLinkCode)
                .collect(Collectors.toSet());

        List<OutageInterval> completed = findCompleted(context, query, links, ongoingLinkCodes);

        log.debug("Status outages: {} ongoing, {} completed", ongoing.size(), completed.size());

        List<OutageInterval> result = new ArrayList<>(ongoing);
        result.addAll(completed);
        return result;
    }

    private List<OutageInterval> findOngoing(Map<String, LinkMetadata> links) {
        List<LinkMetadata> drained = links.values().stream()
                .filter(LinkMetadata::isDrained)
                .collect(Collectors.toList());
        if (drained.isEmpty()) {
            return List.of();
        }

        Map<String, DrainStart> drainStarts = statusChangeRepository.findLatestDrainStarts(
                drained.stream().map(LinkMetadata::getLinkPk).collect(Collectors.toList()));

        IntervalIdSequence ids = IntervalIdSequence.forOngoing(OutageCategory.STATUS);
        List<OutageInterval> ongoing = new ArrayList<>();

        for (LinkMetadata link : drained) {
            DrainStart start = drainStarts.get(link.getLinkPk());
            boolean resolved = start != null && TimeUtils.isPlausible(start.getChangedAt());

            if (!resolved) {
                log.warn("No drain start found for currently drained link {}", link.getLinkCode());
            }

            ongoing.add(OutageInterval.forLink(link, OutageCategory.STATUS)
                    .id(ids.next())
                    .previousStatus(start != null
                            ? start.getPreviousStatus().getCode()
                            : LinkStatus.ACTIVATED.getCode())
                    .newStatus(link.getStatus().getCode())
                    .startedAt(resolved ? start.getChangedAt() : null)
                    .build());
        }
        return ongoing;
    }

    private List<OutageInterval> findCompleted(DetectionContext context, OutageQuery query,
                                               Map<String, LinkMetadata> links, Set<String> excludedLinkCodes) {
        Map<String, LinkMetadata> candidates = new LinkedHashMap<>();
        links.forEach((pk, link) -> {
            if (!excludedLinkCodes.contains(link.getLinkCode())) {
                candidates.put(pk, link);
            }
        });
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<StatusTransition> transitions = statusChangeRepository.findTransitions(
                candidates.keySet(), context.since(query.getLookback()));
        context.checkpoint("status: transition log");

        Map<String, List<StatusTransition>> byLink = new LinkedHashMap<>();
        Set<String> unknownLinks = new HashSet<>();
        for (StatusTransition t : transitions) {
            if (!candidates.containsKey(t.getLinkPk())) {
                unknownLinks.add(t.getLinkPk());
                continue;
            }
            byLink.computeIfAbsent(t.getLinkPk(), k -> new ArrayList<>()).add(t);
        }
        if (!unknownLinks.isEmpty()) {
            log.debug("Ignoring transitions of {} links outside the filtered catalog", unknownLinks.size());
        }

        IntervalIdSequence ids = IntervalIdSequence.forCompleted(OutageCategory.STATUS);
        List<OutageInterval> completed = new ArrayList<>();
        for (Map.Entry<String, List<StatusTransition>> entry : byLink.entrySet()) {
            completed.addAll(StatusTransitionPairer.pair(candidates.get(entry.getKey()), entry.getValue(), ids));
        }
        return completed;
    }
}
