package com.company.outages.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkOutagesResponse implements Serializable {
    private static final long serialVersionUID = 1L;

    private List<OutageResponse> outages;
    private OutageSummary summary;
}
