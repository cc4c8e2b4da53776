package com.company.outages.service;

import com.company.outages.domain.LinkLastSeen;
import com.company.outages.domain.LinkMetadata;
import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.SampleBucket;
import com.company.outages.domain.enums.LinkStatus;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.repository.LinkCatalogRepository;
import com.company.outages.repository.LinkLatencyRepository;
import com.company.outages.repository.LinkStatusChangeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.company.outages.service.StatusOutageDetectorTest.link;
import static com.company.outages.service.StatusOutageDetectorTest.transition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NoDataOutageDetectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant WINDOW_START = NOW.minus(Duration.ofHours(24));

    @Mock
    private LinkCatalogRepository catalogRepository;

    @Mock
    private LinkLatencyRepository latencyRepository;

    @Mock
    private LinkStatusChangeRepository statusChangeRepository;

    @Captor
    private ArgumentCaptor<Collection<String>> candidatesCaptor;

    private NoDataOutageDetector detector;
    private DetectionContext context;

    @BeforeEach
    void setUp() {
        detector = new NoDataOutageDetector(catalogRepository, latencyRepository, statusChangeRepository);
        context = DetectionContext.withTimeout(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(30));

        Map<String, LinkMetadata> links = new LinkedHashMap<>();
        links.put("pk-2", link("pk-2", "L2", LinkStatus.ACTIVATED));
        links.put("pk-5", link("pk-5", "L5", LinkStatus.ACTIVATED));
        links.put("pk-6", link("pk-6", "L6", LinkStatus.HARD_DRAINED));
        when(catalogRepository.findLinks(anyMap())).thenReturn(links);
    }

    @Test
    void detectsGapsAndSilentLinksExceptThoseExplainedByDrains() {
        // L2 soft-drained 10:00-11:00
        when(statusChangeRepository.findTransitions(anyCollection(), eq(WINDOW_START))).thenReturn(List.of(
                transition("pk-2", LinkStatus.ACTIVATED, LinkStatus.SOFT_DRAINED, at("10:00")),
                transition("pk-2", LinkStatus.SOFT_DRAINED, LinkStatus.ACTIVATED, at("11:00"))));

        when(latencyRepository.findLastSeen(anyCollection(), eq(NOW.minus(Duration.ofDays(30))))).thenReturn(List.of(
                new LinkLastSeen("pk-2", NOW.minusSeconds(120)),
                new LinkLastSeen("pk-5", NOW.minus(Duration.ofMinutes(20))),
                new LinkLastSeen("pk-6", NOW.minus(Duration.ofHours(6)))));

        when(latencyRepository.findSampleBuckets(candidatesCaptor.capture(), eq(WINDOW_START))).thenReturn(List.of(
                // 20-minute gap entirely inside the drain
                new SampleBucket("pk-2", at("10:05")),
                new SampleBucket("pk-2", at("10:25")),
                // 20-minute gap with the link activated
                new SampleBucket("pk-2", at("11:30")),
                new SampleBucket("pk-2", at("11:50")),
                new SampleBucket("pk-2", at("11:55")),
                // drained for the whole window
                new SampleBucket("pk-6", at("05:00")),
                new SampleBucket("pk-6", at("05:30"))));

        List<OutageInterval> result = detector.detect(context, OutageQuery.defaults());

        assertThat(candidatesCaptor.getValue()).containsExactly("pk-2", "pk-6");
        assertThat(result).hasSize(2);

        OutageInterval ongoing = result.get(0);
        assertThat(ongoing.getId()).isEqualTo("nodata-1");
        assertThat(ongoing.getLinkCode()).isEqualTo("L5");
        assertThat(ongoing.isOngoing()).isTrue();
        assertThat(ongoing.getStartedAt()).isEqualTo(NOW.minus(Duration.ofMinutes(15)));

        OutageInterval completed = result.get(1);
        assertThat(completed.getId()).isEqualTo("nodata-1001");
        assertThat(completed.getLinkCode()).isEqualTo("L2");
        assertThat(completed.getStartedAt()).isEqualTo(at("11:35"));
        assertThat(completed.getEndedAt()).isEqualTo(at("11:50"));

        assertThat(result).noneMatch(o -> o.getLinkCode().equals("L6"));
    }

    @Test
    void gapsShorterThanMinimumAreIgnored() {
        when(statusChangeRepository.findTransitions(anyCollection(), eq(WINDOW_START))).thenReturn(List.of());
        when(latencyRepository.findLastSeen(anyCollection(), eq(NOW.minus(Duration.ofDays(30))))).thenReturn(List.of());
        when(latencyRepository.findSampleBuckets(anyCollection(), eq(WINDOW_START))).thenReturn(List.of(
                new SampleBucket("pk-5", at("09:00")),
                new SampleBucket("pk-5", at("09:10")),
                new SampleBucket("pk-5", at("09:25"))));

        List<OutageInterval> result = detector.detect(context, OutageQuery.defaults());

        assertThat(result).singleElement().satisfies(interval -> {
            assertThat(interval.getStartedAt()).isEqualTo(at("09:15"));
            assertThat(interval.getEndedAt()).isEqualTo(at("09:25"));
        });
    }

    @Test
    void gapOverlappingOpenDrainIsSuppressed() {
        when(statusChangeRepository.findTransitions(anyCollection(), eq(WINDOW_START))).thenReturn(List.of(
                transition("pk-6", LinkStatus.ACTIVATED, LinkStatus.HARD_DRAINED, at("11:00"))));
        when(latencyRepository.findLastSeen(anyCollection(), eq(NOW.minus(Duration.ofDays(30))))).thenReturn(List.of());
        when(latencyRepository.findSampleBuckets(anyCollection(), eq(WINDOW_START))).thenReturn(List.of(
                new SampleBucket("pk-6", at("10:30")),
                new SampleBucket("pk-6", at("11:45"))));

        assertThat(detector.detect(context, OutageQuery.defaults())).isEmpty();
        verify(latencyRepository).findSampleBuckets(anyCollection(), eq(WINDOW_START));
    }

    private static Instant at(String hhmm) {
        return Instant.parse("2024-05-01T" + hhmm + ":00Z");
    }
}
