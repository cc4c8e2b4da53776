package com.company.outages.service;

import com.company.outages.domain.DrainedPeriod;
import com.company.outages.domain.StatusTransition;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the spans during which links were drained, used to keep reporting gaps that are
 * explained by a drain out of the no-data results.
 */
final class DrainedPeriodTracker {

    private DrainedPeriodTracker() {
    }

    /**
     * @param transitions        status transitions since {@code windowStart}, any link order
     * @param currentlyDrained   pks of links whose current status is drained
     * @param windowStart        start of the scanned window
     */
    static Map<String, List<DrainedPeriod>> build(Collection<StatusTransition> transitions,
                                                  Set<String> currentlyDrained,
                                                  Instant windowStart) {
        Map<String, List<StatusTransition>> byLink = new HashMap<>();
        for (StatusTransition t : transitions) {
            byLink.computeIfAbsent(t.getLinkPk(), k -> new ArrayList<>()).add(t);
        }

        Map<String, List<DrainedPeriod>> result = new HashMap<>();
        byLink.forEach((linkPk, linkTransitions) -> {
            linkTransitions.sort(Comparator.comparing(StatusTransition::getChangedAt));
            List<DrainedPeriod> periods = periodsOf(linkTransitions, windowStart);
            if (!periods.isEmpty()) {
                result.put(linkPk, periods);
            }
        });

        // drained since before the window with nothing logged inside it
        for (String linkPk : currentlyDrained) {
            result.computeIfAbsent(linkPk, k -> List.of(DrainedPeriod.open(windowStart)));
        }
        return result;
    }

    private static List<DrainedPeriod> periodsOf(List<StatusTransition> ordered, Instant windowStart) {
        List<DrainedPeriod> periods = new ArrayList<>();
        Instant drainStart = null;
        boolean first = true;

        for (StatusTransition t : ordered) {
            if (t.getNewStatus().isDrained() && drainStart == null) {
                drainStart = first && t.getPreviousStatus().isDrained() ? windowStart : t.getChangedAt();
            } else if (t.isRecovery() && (drainStart != null || first)) {
                // a recovery first in the window closes a drain that began before it
                Instant start = drainStart != null ? drainStart : windowStart;
                periods.add(DrainedPeriod.closed(start, t.getChangedAt()));
                drainStart = null;
            }
            first = false;
        }

        if (drainStart != null) {
            periods.add(DrainedPeriod.open(drainStart));
        }
        return periods;
    }
}
