package com.company.outages.repository;

import com.company.outages.domain.DrainStart;
import com.company.outages.domain.StatusTransition;
import com.company.outages.domain.enums.LinkStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reader for the link status-change event log
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LinkStatusChangeRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Status transitions of the given links since {@code since}.
     * Rows come back ordered by link and time, but callers must not rely on cross-link order.
     */
    public List<StatusTransition> findTransitions(Collection<String> linkPks, Instant since) {
        if (linkPks.isEmpty()) {
            return List.of();
        }

        String sql = String.format("""
            SELECT link_pk, link_code, previous_status, new_status, changed_ts
            FROM dz_link_status_changes
            WHERE changed_ts >= ?
              AND link_pk IN (%s)
            ORDER BY link_pk, changed_ts
            """, SqlSupport.placeholders(linkPks));

        List<Object> args = new ArrayList<>();
        args.add(SqlSupport.timestamp(since));
        args.addAll(linkPks);

        List<StatusTransition> transitions = jdbcTemplate.query(sql, (rs, rowNum) -> StatusTransition.builder()
                .linkPk(rs.getString("link_pk"))
                .linkCode(rs.getString("link_code"))
                .previousStatus(LinkStatus.fromString(rs.getString("previous_status")))
                .newStatus(LinkStatus.fromString(rs.getString("new_status")))
                .changedAt(SqlSupport.getInstant(rs, "changed_ts"))
                .build(), args.toArray());

        log.debug("Loaded {} status transitions for {} links since {}", transitions.size(), linkPks.size(), since);
        return transitions;
    }

    /**
     * Most recent activated -> drained transition per link, searched over the full log.
     * Links that never had one are absent from the result.
     */
    public Map<String, DrainStart> findLatestDrainStarts(Collection<String> linkPks) {
        if (linkPks.isEmpty()) {
            return Map.of();
        }

        String sql = String.format("""
            SELECT link_pk, previous_status, changed_ts
            FROM (
                SELECT
                    link_pk,
                    previous_status,
                    changed_ts,
                    ROW_NUMBER() OVER (PARTITION BY link_pk ORDER BY changed_ts DESC) AS rn
                FROM dz_link_status_changes
                WHERE link_pk IN (%s)
                  AND new_status IN ('soft-drained', 'hard-drained')
                  AND previous_status = 'activated'
            ) ranked
            WHERE rn = 1
            """, SqlSupport.placeholders(linkPks));

        List<DrainStart> starts = jdbcTemplate.query(sql, (rs, rowNum) -> DrainStart.builder()
                .linkPk(rs.getString("link_pk"))
                .previousStatus(LinkStatus.fromString(rs.getString("previous_status")))
                .changedAt(SqlSupport.getInstant(rs, "changed_ts"))
                .build(), linkPks.toArray());

        Map<String, DrainStart> byLink = new HashMap<>();
        for (DrainStart start : starts) {
            byLink.put(start.getLinkPk(), start);
        }
        return byLink;
    }
}
