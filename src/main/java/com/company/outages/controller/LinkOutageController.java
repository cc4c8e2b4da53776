package com.company.outages.controller;

import com.company.outages.cache.OutageSnapshot;
import com.company.outages.cache.OutageSnapshotCache;
import com.company.outages.domain.enums.DetectionMode;
import com.company.outages.dto.request.OutageQuery;
import com.company.outages.dto.response.LinkOutagesResponse;
import com.company.outages.exception.InvalidOutageRequestException;
import com.company.outages.service.LinkOutageService;
import com.company.outages.service.OutageCsvWriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

@RestController
@RequestMapping("/api/v1/outages")
@Tag(name = "Link Outages", description = "Reconstructed link outage intervals")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class LinkOutageController {

    static final String CACHE_HEADER = "X-Cache";
    static final String CSV_FILENAME = "link-outages.csv";

    private static final Set<String> ACCEPTED_PARAMETERS = Set.of("range", "threshold", "type", "filter");

    private final LinkOutageService outageService;
    private final OutageSnapshotCache snapshotCache;
    private final OutageCsvWriter csvWriter;
    private final MeterRegistry meterRegistry;

    @GetMapping
    @Operation(
            summary = "List link outages",
            description = "Status, packet-loss and no-data outages over the selected range. "
                    + "The default parameter set is served from a periodically refreshed snapshot."
    )
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<LinkOutagesResponse> getOutages(
            @Parameter(description = "3h, 6h, 12h, 24h, 3d, 7d or 30d")
            @RequestParam(required = false) String range,
            @Parameter(description = "Packet loss threshold percent: 1 or 10")
            @RequestParam(required = false) String threshold,
            @Parameter(description = "all, status, loss or no_data")
            @RequestParam(required = false) String type,
            @Parameter(description = "Comma separated kind:value pairs, kinds metro, link, contributor, device")
            @RequestParam(required = false) String filter,
            @RequestParam Map<String, String> allParameters) {

        OutageQuery query = parseQuery(range, threshold, type, filter, allParameters);

        if (query.isDefault()) {
            Optional<OutageSnapshot> snapshot = snapshotCache.get();
            if (snapshot.isPresent()) {
                countRequest(query, "json", "hit");
                return ResponseEntity.ok()
                        .header(CACHE_HEADER, "HIT")
                        .cacheControl(CacheControl.maxAge(30, TimeUnit.SECONDS).cachePrivate())
                        .body(snapshot.get().getResponse());
            }
        }

        countRequest(query, "json", "miss");
        LinkOutagesResponse response = outageService.getOutages(query, DetectionMode.STRICT);

        return ResponseEntity.ok()
                .header(CACHE_HEADER, "MISS")
                .body(response);
    }

    @GetMapping("/csv")
    @Operation(summary = "Export link outages as CSV", description = "Same rows as the JSON listing, without the summary")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<String> exportCsv(
            @RequestParam(required = false) String range,
            @RequestParam(required = false) String threshold,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String filter,
            @RequestParam Map<String, String> allParameters) throws IOException {

        OutageQuery query = parseQuery(range, threshold, type, filter, allParameters);
        countRequest(query, "csv", "miss");

        LinkOutagesResponse response = outageService.getOutages(query, DetectionMode.STRICT);

        StringWriter out = new StringWriter();
        csvWriter.write(response.getOutages(), out);

        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + CSV_FILENAME)
                .body(out.toString());
    }

    private OutageQuery parseQuery(String range, String threshold, String type, String filter,
                                   Map<String, String> allParameters) {
        for (String name : allParameters.keySet()) {
            if (!ACCEPTED_PARAMETERS.contains(name)) {
                throw new InvalidOutageRequestException("parameter", name,
                        "accepted parameters are range, threshold, type, filter");
            }
        }
        return OutageQuery.fromParameters(range, threshold, type, filter);
    }

    private void countRequest(OutageQuery query, String format, String cache) {
        meterRegistry.counter("api.outages.requests",
                "type", query.getType().getCode(),
                "range", query.getRange().getCode(),
                "format", format,
                "cache", cache
        ).increment();
    }
}
