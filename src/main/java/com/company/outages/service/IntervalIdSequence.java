package com.company.outages.service;

import com.company.outages.domain.enums.OutageCategory;

/**
 * Request-local serial ids such as {@code status-3} or {@code nodata-1002}.
 * Ongoing and completed intervals of a category draw from disjoint ranges.
 */
class IntervalIdSequence {

    static final int ONGOING_BASE = 0;
    static final int COMPLETED_BASE = 1000;

    private final String prefix;
    private int counter;

    private IntervalIdSequence(OutageCategory category, int base) {
        this.prefix = category.getIdPrefix();
        this.counter = base;
    }

    static IntervalIdSequence forOngoing(OutageCategory category) {
        return new IntervalIdSequence(category, ONGOING_BASE);
    }

    static IntervalIdSequence forCompleted(OutageCategory category) {
        return new IntervalIdSequence(category, COMPLETED_BASE);
    }

    String next() {
        counter++;
        return prefix + "-" + counter;
    }
}
