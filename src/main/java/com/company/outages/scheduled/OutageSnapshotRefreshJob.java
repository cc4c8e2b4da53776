package com.company.outages.scheduled;

import com.company.outages.cache.OutageSnapshot;
import com.company.outages.cache.OutageSnapshotCache;
import com.company.outages.dto.response.LinkOutagesResponse;
import com.company.outages.service.LinkOutageService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Recomputes the default outage view on a fixed delay and publishes it to the snapshot cache.
 * A failed refresh leaves the previous snapshot in place.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "outages.snapshot.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class OutageSnapshotRefreshJob {

    private final LinkOutageService outageService;
    private final OutageSnapshotCache snapshotCache;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${outages.snapshot.refresh-interval-ms:60000}",
            initialDelayString = "${outages.snapshot.initial-delay-ms:0}"
    )
    public void refreshDefaultSnapshot() {
        Instant startedAt = clock.instant();
        try {
            LinkOutagesResponse response = outageService.computeDefaultSnapshot();

            snapshotCache.store(OutageSnapshot.builder()
                    .response(response)
                    .refreshedAt(startedAt)
                    .build());

            meterRegistry.counter("outages.snapshot.refreshes", "result", "success").increment();
            log.info("Outage snapshot refreshed: {} outages ({} ongoing) in {}ms",
                    response.getSummary().getTotal(),
                    response.getSummary().getOngoing(),
                    clock.millis() - startedAt.toEpochMilli());

        } catch (Exception e) {
            meterRegistry.counter("outages.snapshot.refreshes", "result", "failure").increment();
            log.error("Outage snapshot refresh failed, keeping previous snapshot", e);
        }
    }
}
