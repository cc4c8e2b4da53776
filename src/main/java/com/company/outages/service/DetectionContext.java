package com.company.outages.service;

import com.company.outages.exception.OutageQueryCancelledException;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-request detection state: the fixed "now" every window is computed from, and the
 * deadline after which detection is abandoned.
 */
public class DetectionContext {

    private final Clock clock;

    @Getter
    private final Instant now;

    private final Instant deadline;

    private DetectionContext(Clock clock, Instant now, Instant deadline) {
        this.clock = clock;
        this.now = now;
        this.deadline = deadline;
    }

    public static DetectionContext withTimeout(Clock clock, Duration timeout) {
        Instant now = clock.instant();
        return new DetectionContext(clock, now, now.plus(timeout));
    }

    /**
     * Window start for a lookback measured back from {@link #getNow()}
     */
    public Instant since(Duration lookback) {
        return now.minus(lookback);
    }

    /**
     * @throws OutageQueryCancelledException if the deadline passed or the thread was interrupted
     */
    public void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OutageQueryCancelledException("Outage detection interrupted during " + stage);
        }
        if (clock.instant().isAfter(deadline)) {
            throw new OutageQueryCancelledException("Outage detection deadline exceeded during " + stage);
        }
    }
}
