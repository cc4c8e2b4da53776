package com.company.outages.service;

import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.enums.DetectionMode;
import com.company.outages.domain.enums.OutageCategory;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.dto.response.LinkOutagesResponse;
import com.company.outages.exception.OutageDetectionException;
import com.company.outages.exception.OutageQueryCancelledException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the detectors one after another for a query and aggregates their results.
 * <p>
 * In {@link DetectionMode#STRICT} the first detector failure fails the request; in
 * {@link DetectionMode#DEGRADED} a failing category is logged and contributes nothing.
 * Cancellation always propagates.
 */
@Service
@Slf4j
public class LinkOutageService {

    private final Map<OutageCategory, OutageDetector> detectors = new EnumMap<>(OutageCategory.class);
    private final OutageAggregator aggregator;
    private final Clock clock;
    private final Tracer tracer;
    private final MeterRegistry meterRegistry;
    private final Duration queryTimeout;

    public LinkOutageService(List<OutageDetector> detectors,
                             OutageAggregator aggregator,
                             Clock clock,
                             Tracer tracer,
                             MeterRegistry meterRegistry,
                             @Value("${outages.query.timeout:30s}") Duration queryTimeout) {
        for (OutageDetector detector : detectors) {
            this.detectors.put(detector.getCategory(), detector);
        }
        this.aggregator = aggregator;
        this.clock = clock;
        this.tracer = tracer;
        this.meterRegistry = meterRegistry;
        this.queryTimeout = queryTimeout;
    }

    public LinkOutagesResponse getOutages(OutageQuery query, DetectionMode mode) {
        DetectionContext context = DetectionContext.withTimeout(clock, queryTimeout);

        log.debug("Detecting outages: range={}, threshold={}%, type={}, filters={}, mode={}",
                query.getRange().getCode(), query.getThresholdPct(), query.getType().getCode(),
                query.getFilters(), mode);

        Map<OutageCategory, List<OutageInterval>> results = new EnumMap<>(OutageCategory.class);
        for (OutageCategory category : OutageCategory.values()) {
            if (!query.getType().includes(category)) {
                continue;
            }
            results.put(category, runDetector(category, context, query, mode));
        }

        context.checkpoint("aggregation");
        return aggregator.aggregate(results.values());
    }

    /**
     * Fresh result for the default parameters (24h, 1%, all types, no filters), computed in
     * degraded mode. Entry point for the snapshot refresher.
     */
    public LinkOutagesResponse computeDefaultSnapshot() {
        return getOutages(OutageQuery.defaults(), DetectionMode.DEGRADED);
    }

    private List<OutageInterval> runDetector(OutageCategory category, DetectionContext context,
                                             OutageQuery query, DetectionMode mode) {
        OutageDetector detector = detectors.get(category);
        if (detector == null) {
            throw new IllegalStateException("No detector registered for " + category);
        }

        Span span = tracer.spanBuilder("outages.detect." + category.getCode())
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("outage.category", category.getCode());
            span.setAttribute("detection.mode", mode.name());

            List<OutageInterval> intervals = detector.detect(context, query);

            span.setAttribute("outage.count", intervals.size());
            return intervals;

        } catch (OutageQueryCancelledException e) {
            span.setStatus(StatusCode.ERROR, "cancelled");
            log.warn("{} outage detection cancelled: {}", category, e.getMessage());
            throw e;

        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "detection failed");

            meterRegistry.counter("outages.detector.failures",
                    "category", category.getCode(),
                    "mode", mode.name().toLowerCase()
            ).increment();

            if (mode == DetectionMode.STRICT) {
                throw new OutageDetectionException(category, e);
            }

            log.error("Failed to fetch {} outages, continuing without them", category, e);
            return List.of();

        } finally {
            sample.stop(meterRegistry.timer("outages.detection.duration", "category", category.getCode()));
            span.end();
        }
    }
}
