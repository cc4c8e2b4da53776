package com.company.outages.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutageSummary implements Serializable {
    private static final long serialVersionUID = 1L;

    private int total;
    private int ongoing;

    // keyed by category code, every category present
    private Map<String, Integer> byType;
}
