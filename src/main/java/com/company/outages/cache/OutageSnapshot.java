package com.company.outages.cache;

import com.company.outages.dto.response.LinkOutagesResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Precomputed result for the default query, with the time it was computed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutageSnapshot implements Serializable {
    private static final long serialVersionUID = 1L;

    private LinkOutagesResponse response;
    private Instant refreshedAt;
}
