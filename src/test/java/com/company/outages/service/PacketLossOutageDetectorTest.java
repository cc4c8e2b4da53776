package com.company.outages.service;

import com.company.outages.domain.LinkMetadata;
import com.company.outages.domain.LossBucket;
import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.RecentLoss;
import com.company.outages.domain.enums.LinkStatus;
import com.company.outages.domain.enums.LossThreshold;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.repository.LinkCatalogRepository;
import com.company.outages.repository.LinkLatencyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.company.outages.service.StatusOutageDetectorTest.link;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PacketLossOutageDetectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant RECENT_SINCE = NOW.minus(Duration.ofMinutes(10));
    private static final Instant HISTORY_SINCE = NOW.minus(Duration.ofDays(30));

    @Mock
    private LinkCatalogRepository catalogRepository;

    @Mock
    private LinkLatencyRepository latencyRepository;

    private PacketLossOutageDetector detector;
    private DetectionContext context;

    @BeforeEach
    void setUp() {
        detector = new PacketLossOutageDetector(catalogRepository, latencyRepository);
        context = DetectionContext.withTimeout(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(30));

        Map<String, LinkMetadata> links = new LinkedHashMap<>();
        links.put("pk-3", link("pk-3", "L3", LinkStatus.ACTIVATED));
        links.put("pk-4", link("pk-4", "L4", LinkStatus.ACTIVATED));
        when(catalogRepository.findLinks(anyMap())).thenReturn(links);
    }

    @Test
    void ongoingLossStartsWhereHistoryCrossedThreshold() {
        when(latencyRepository.findRecentLoss(anyCollection(), eq(RECENT_SINCE), eq(3))).thenReturn(List.of(
                recent("pk-3", 5.0),
                recent("pk-4", 0.4)));

        // below 1% until 40 minutes ago, then continuously at or above
        List<LossBucket> history = new ArrayList<>();
        Instant start = NOW.minus(Duration.ofHours(2));
        for (Instant t = start; t.isBefore(NOW); t = t.plus(LossBucket.WIDTH)) {
            boolean above = !t.isBefore(NOW.minus(Duration.ofMinutes(40)));
            history.add(bucket("pk-3", t, above ? 5.0 : 0.2));
        }
        when(latencyRepository.findLossHistory("pk-3", HISTORY_SINCE, 3)).thenReturn(history);
        when(latencyRepository.findLossBuckets(eq(List.of("pk-4")), eq(NOW.minus(Duration.ofHours(24))), eq(3)))
                .thenReturn(List.of());

        List<OutageInterval> result = detector.detect(context, OutageQuery.defaults());

        assertThat(result).singleElement().satisfies(interval -> {
            assertThat(interval.getId()).isEqualTo("loss-1");
            assertThat(interval.getLinkCode()).isEqualTo("L3");
            assertThat(interval.isOngoing()).isTrue();
            assertThat(interval.getStartedAt()).isEqualTo(NOW.minus(Duration.ofMinutes(40)));
            assertThat(interval.getThresholdPct()).isEqualTo(1.0);
            assertThat(interval.getPeakLossPct()).isEqualTo(5.0);
        });
    }

    @Test
    void fallsBackToRecentWindowWhenHistoryHasNoCrossing() {
        Instant lastSeen = NOW.minusSeconds(30);
        when(latencyRepository.findRecentLoss(anyCollection(), eq(RECENT_SINCE), eq(3))).thenReturn(List.of(
                RecentLoss.builder().linkPk("pk-3").lossPct(2.5).sampleCount(20).lastSeen(lastSeen).build()));
        when(latencyRepository.findLossHistory("pk-3", HISTORY_SINCE, 3)).thenReturn(List.of());
        when(latencyRepository.findLossBuckets(eq(List.of("pk-4")), any(Instant.class), eq(3))).thenReturn(List.of());

        List<OutageInterval> result = detector.detect(context, OutageQuery.defaults());

        assertThat(result).singleElement().satisfies(interval -> {
            assertThat(interval.getStartedAt()).isEqualTo(lastSeen.minus(Duration.ofMinutes(10)));
            assertThat(interval.getPeakLossPct()).isEqualTo(2.5);
        });
    }

    @Test
    void completedCrossingsComeFromLookbackBuckets() {
        when(latencyRepository.findRecentLoss(anyCollection(), eq(RECENT_SINCE), eq(3))).thenReturn(List.of());

        Instant b0 = NOW.minus(Duration.ofHours(3));
        when(latencyRepository.findLossBuckets(eq(List.of("pk-3", "pk-4")), eq(NOW.minus(Duration.ofHours(24))), eq(3)))
                .thenReturn(List.of(
                        bucket("pk-4", b0, 0.5),
                        bucket("pk-4", b0.plus(LossBucket.WIDTH), 2.0),
                        bucket("pk-4", b0.plus(LossBucket.WIDTH.multipliedBy(2)), 3.0),
                        bucket("pk-4", b0.plus(LossBucket.WIDTH.multipliedBy(3)), 0.8)));

        List<OutageInterval> result = detector.detect(context, OutageQuery.defaults());

        assertThat(result).singleElement().satisfies(interval -> {
            assertThat(interval.getId()).isEqualTo("loss-1001");
            assertThat(interval.getLinkCode()).isEqualTo("L4");
            assertThat(interval.getStartedAt()).isEqualTo(b0.plus(LossBucket.WIDTH));
            assertThat(interval.getEndedAt()).isEqualTo(b0.plus(LossBucket.WIDTH.multipliedBy(3)));
            assertThat(interval.getDurationSeconds()).isEqualTo(600L);
            assertThat(interval.getPeakLossPct()).isEqualTo(3.0);
        });
        verify(latencyRepository, never()).findLossHistory(any(), any(), eq(3));
    }

    @Test
    void recentLossBelowSelectedThresholdIsNotOngoing() {
        OutageQuery query = OutageQuery.builder().threshold(LossThreshold.TEN_PERCENT).build();
        when(latencyRepository.findRecentLoss(anyCollection(), eq(RECENT_SINCE), eq(3))).thenReturn(List.of(
                recent("pk-3", 5.0)));
        when(latencyRepository.findLossBuckets(eq(List.of("pk-3", "pk-4")), any(Instant.class), eq(3)))
                .thenReturn(List.of());

        assertThat(detector.detect(context, query)).isEmpty();
        verify(latencyRepository, never()).findLossHistory(any(), any(), eq(3));
    }

    private static RecentLoss recent(String pk, double lossPct) {
        return RecentLoss.builder().linkPk(pk).lossPct(lossPct).sampleCount(20).lastSeen(NOW.minusSeconds(20)).build();
    }

    private static LossBucket bucket(String pk, Instant start, double lossPct) {
        return LossBucket.builder().linkPk(pk).bucketStart(start).lossPct(lossPct).sampleCount(30).build();
    }
}
