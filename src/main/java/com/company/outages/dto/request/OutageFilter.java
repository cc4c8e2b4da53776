package com.company.outages.dto.request;

import com.company.outages.domain.enums.FilterKind;
import com.company.outages.exception.InvalidOutageRequestException;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * A single {@code kind:value} dimension filter, e.g. {@code metro:SAO}
 */
@Value
public class OutageFilter {
    FilterKind kind;
    String value;

    /**
     * Parses the comma separated {@code filter} request parameter.
     * Blank input yields no filters.
     */
    public static List<OutageFilter> parseAll(String filterParam) {
        List<OutageFilter> filters = new ArrayList<>();
        if (filterParam == null || filterParam.isBlank()) {
            return filters;
        }

        for (String entry : filterParam.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            int separator = trimmed.indexOf(':');
            if (separator <= 0) {
                throw new InvalidOutageRequestException("filter", trimmed,
                        "expected kind:value");
            }

            String kindCode = trimmed.substring(0, separator);
            String value = trimmed.substring(separator + 1).trim();

            FilterKind kind = FilterKind.fromCode(kindCode)
                    .orElseThrow(() -> new InvalidOutageRequestException("filter", trimmed,
                            "kind must be one of metro, link, contributor, device"));

            if (value.isEmpty()) {
                throw new InvalidOutageRequestException("filter", trimmed, "value must not be empty");
            }

            filters.add(new OutageFilter(kind, value));
        }
        return filters;
    }

    @Override
    public String toString() {
        return kind.getCode() + ":" + value;
    }
}
