package com.company.outages.service;

import com.company.outages.domain.OutageInterval;
import com.company.outages.domain.enums.OutageCategory;
import com.company.outages.dto.request.OutageQuery;

import java.util.List;

/**
 * Reconstructs the outages of one category. Implementations keep no state between calls;
 * for every link at most one returned interval is ongoing and no completed interval overlaps it.
 */
public interface OutageDetector {

    OutageCategory getCategory();

    /**
     * @throws org.springframework.dao.DataAccessException when the telemetry store fails
     * @throws com.company.outages.exception.OutageQueryCancelledException when the request deadline passes
     */
    List<OutageInterval> detect(DetectionContext context, OutageQuery query);
}
