package com.company.outages.controller;

import com.company.outages.cache.OutageSnapshot;
import com.company.outages.cache.OutageSnapshotCache;
import com.company.outages.domain.enums.DetectionMode;
import com.company.outages.domain.enums.OutageCategory;
import com.company.outages.domain.enums.TimeRange;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.dto.response.LinkOutagesResponse;
import com.company.outages.dto.response.OutageResponse;
import com.company.outages.dto.response.OutageSummary;
import com.company.outages.exception.GlobalExceptionHandler;
import com.company.outages.exception.OutageDetectionException;
import com.company.outages.exception.OutageQueryCancelledException;
import com.company.outages.service.LinkOutageService;
import com.company.outages.service.OutageCsvWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LinkOutageControllerTest {

    @Mock
    private LinkOutageService outageService;

    @Mock
    private OutageSnapshotCache snapshotCache;

    private SimpleMeterRegistry meterRegistry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        LinkOutageController controller = new LinkOutageController(
                outageService, snapshotCache, new OutageCsvWriter(), meterRegistry);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void defaultQueryIsServedFromSnapshot() throws Exception {
        when(snapshotCache.get()).thenReturn(Optional.of(OutageSnapshot.builder()
                .response(response("status-1"))
                .refreshedAt(Instant.parse("2024-05-01T12:00:00Z"))
                .build()));

        mockMvc.perform(get("/api/v1/outages"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "HIT"))
                .andExpect(jsonPath("$.outages[0].id").value("status-1"))
                .andExpect(jsonPath("$.outages[0].isOngoing").value(true))
                .andExpect(jsonPath("$.summary.byType.packet_loss").value(0));

        verifyNoInteractions(outageService);
    }

    @Test
    void defaultQueryWithoutSnapshotIsComputedStrictly() throws Exception {
        when(snapshotCache.get()).thenReturn(Optional.empty());
        when(outageService.getOutages(OutageQuery.defaults(), DetectionMode.STRICT)).thenReturn(response("loss-1"));

        mockMvc.perform(get("/api/v1/outages").param("range", "24h").param("threshold", "1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(jsonPath("$.outages[0].id").value("loss-1"));
    }

    @Test
    void nonDefaultQueryBypassesSnapshot() throws Exception {
        when(outageService.getOutages(argThat(q -> q.getRange() == TimeRange.D7 && q.getFilters().size() == 1),
                eq(DetectionMode.STRICT))).thenReturn(response("nodata-1"));

        mockMvc.perform(get("/api/v1/outages").param("range", "7d").param("filter", "metro:SAO"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "MISS"));

        verify(snapshotCache, never()).get();
        assertThat(meterRegistry.counter("api.outages.requests",
                "type", "all", "range", "7d", "format", "json", "cache", "miss").count()).isEqualTo(1.0);
    }

    @Test
    void invalidParameterValueIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/outages").param("range", "2h"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message", startsWith("Invalid range '2h'")));

        verifyNoInteractions(outageService);
    }

    @Test
    void unknownParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/outages").param("limit", "10"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("'limit'")));
    }

    @Test
    void detectionFailureIsInternalError() throws Exception {
        when(outageService.getOutages(any(), eq(DetectionMode.STRICT))).thenThrow(
                new OutageDetectionException(OutageCategory.NO_DATA, new DataAccessResourceFailureException("down")));

        mockMvc.perform(get("/api/v1/outages").param("type", "no_data"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to fetch no-data outages"));
    }

    @Test
    void cancelledQueryIsServiceUnavailable() throws Exception {
        when(outageService.getOutages(any(), eq(DetectionMode.STRICT)))
                .thenThrow(new OutageQueryCancelledException("Outage detection deadline exceeded during status: link catalog"));

        mockMvc.perform(get("/api/v1/outages").param("type", "status"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void csvExportIsAttachment() throws Exception {
        when(outageService.getOutages(OutageQuery.defaults(), DetectionMode.STRICT)).thenReturn(response("status-1"));

        mockMvc.perform(get("/api/v1/outages/csv"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=link-outages.csv"))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(startsWith(
                        "id,link_code,link_type,side_a_metro,side_z_metro,contributor,outage_type")))
                .andExpect(content().string(containsString("status-1,L1,WAN,SAO,RIO,acme,status,\"activated -> soft-drained\"")));
    }

    private static LinkOutagesResponse response(String id) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        byType.put("status", 1);
        byType.put("packet_loss", 0);
        byType.put("no_data", 0);

        return LinkOutagesResponse.builder()
                .outages(List.of(OutageResponse.builder()
                        .id(id)
                        .linkPk("pk-1")
                        .linkCode("L1")
                        .linkType("WAN")
                        .sideAMetro("SAO")
                        .sideZMetro("RIO")
                        .contributorCode("acme")
                        .category("status")
                        .previousStatus("activated")
                        .newStatus("soft-drained")
                        .startedAt("2024-05-01T11:00:00Z")
                        .ongoing(true)
                        .build()))
                .summary(OutageSummary.builder().total(1).ongoing(1).byType(byType).build())
                .build();
    }
}
