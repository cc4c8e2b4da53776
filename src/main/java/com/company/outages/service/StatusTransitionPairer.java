package com.company.outages.service;

import com.company.outages.domain.LinkMetadata;
import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.StatusTransition;
import com.company.outages.domain.enums.OutageCategory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs one link's status transitions into completed drain outages.
 * A drain still open after the last transition is dropped: ongoing drains are
 * reported from the link's current status instead. A drain recovered at the same
 * instant it began has no extent and is dropped too.
 */
class StatusTransitionPairer implements DrainState.Listener {

    private final LinkMetadata link;
    private final IntervalIdSequence ids;
    private final List<OutageInterval> completed = new ArrayList<>();

    private OutageInterval.OutageIntervalBuilder open;
    private Instant openedAt;

    private StatusTransitionPairer(LinkMetadata link, IntervalIdSequence ids) {
        this.link = link;
        this.ids = ids;
    }

    static List<OutageInterval> pair(LinkMetadata link, List<StatusTransition> transitions, IntervalIdSequence ids) {
        List<StatusTransition> ordered = new ArrayList<>(transitions);
        ordered.sort(Comparator.comparing(StatusTransition::getChangedAt));

        StatusTransitionPairer pairer = new StatusTransitionPairer(link, ids);
        DrainState state = DrainState.UP;
        for (StatusTransition transition : ordered) {
            state = state.on(transition, pairer);
        }
        return pairer.completed;
    }

    @Override
    public void opened(StatusTransition transition) {
        open = OutageInterval.forLink(link, OutageCategory.STATUS)
                .previousStatus(transition.getPreviousStatus().getCode())
                .newStatus(transition.getNewStatus().getCode())
                .startedAt(transition.getChangedAt());
        openedAt = transition.getChangedAt();
    }

    @Override
    public void relabelled(StatusTransition transition) {
        open.newStatus(transition.getNewStatus().getCode());
    }

    @Override
    public void closed(StatusTransition transition) {
        if (transition.getChangedAt().isAfter(openedAt)) {
            completed.add(open
                    .id(ids.next())
                    .endedAt(transition.getChangedAt())
                    .build());
        }
        open = null;
        openedAt = null;
    }

    @Override
    public void restarted(StatusTransition transition) {
        opened(transition);
    }
}
