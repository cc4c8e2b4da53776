package com.company.outages.config;

import com.company.outages.cache.OutageSnapshot;
import com.company.outages.cache.OutageSnapshotCache;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Gauges over the cached default snapshot
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final OutageSnapshotCache snapshotCache;
    private final Clock clock;

    @Bean
    public MeterBinder snapshotMetrics() {
        return (reg) -> {
            Gauge.builder("outages.snapshot.ongoing", snapshotCache, cache -> cache.get()
                            .map(s -> (double) s.getResponse().getSummary().getOngoing())
                            .orElse(Double.NaN))
                    .description("Ongoing outages in the cached default snapshot")
                    .register(reg);

            Gauge.builder("outages.snapshot.age.seconds", snapshotCache, this::snapshotAgeSeconds)
                    .description("Seconds since the cached default snapshot was computed")
                    .register(reg);

            log.info("Snapshot metrics registered");
        };
    }

    double snapshotAgeSeconds(OutageSnapshotCache cache) {
        Optional<OutageSnapshot> snapshot = cache.get();
        if (snapshot.isEmpty() || snapshot.get().getRefreshedAt() == null) {
            return Double.NaN;
        }
        return Duration.between(snapshot.get().getRefreshedAt(), clock.instant()).toMillis() / 1000.0;
    }
}
