package com.company.outages.service;

import com.company.outages.dto.response.OutageResponse;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * Flat CSV rendering of outage rows, without the summary
 */
@Component
public class OutageCsvWriter {

    static final String HEADER = "id,link_code,link_type,side_a_metro,side_z_metro,contributor,"
            + "outage_type,details,started_at,ended_at,duration_seconds,is_ongoing";

    public void write(List<OutageResponse> outages, Writer writer) throws IOException {
        writer.write(HEADER);
        writer.write('\n');

        for (OutageResponse o : outages) {
            writer.write(String.join(",",
                    field(o.getId()),
                    field(o.getLinkCode()),
                    field(o.getLinkType()),
                    field(o.getSideAMetro()),
                    field(o.getSideZMetro()),
                    field(o.getContributorCode()),
                    field(o.getCategory()),
                    quoted(details(o)),
                    field(o.getStartedAt()),
                    field(o.getEndedAt()),
                    o.getDurationSeconds() != null ? o.getDurationSeconds().toString() : "",
                    Boolean.toString(o.isOngoing())));
            writer.write('\n');
        }
        writer.flush();
    }

    static String details(OutageResponse o) {
        switch (o.getCategory()) {
            case "status":
                return nullToEmpty(o.getPreviousStatus()) + " -> " + nullToEmpty(o.getNewStatus());
            case "packet_loss":
                return String.format(Locale.ROOT, "peak %.1f%% (threshold %.0f%%)",
                        o.getPeakLossPct() != null ? o.getPeakLossPct() : 0.0,
                        o.getThresholdPct() != null ? o.getThresholdPct() : 0.0);
            default:
                return "no telemetry";
        }
    }

    private static String field(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0 || value.indexOf('\n') >= 0) {
            return quoted(value);
        }
        return value;
    }

    private static String quoted(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
