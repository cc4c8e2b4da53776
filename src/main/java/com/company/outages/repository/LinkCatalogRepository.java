package com.company.outages.repository;

import com.company.outages.domain.LinkMetadata;
import com.company.outages.domain.enums.FilterKind;
import com.company.outages.domain.enums.LinkStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Link dimension catalog: current link rows joined with device metros and contributors.
 * All detectors scope their telemetry scans to the links returned here.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LinkCatalogRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_LINKS = """
        SELECT
            l.pk AS link_pk,
            l.code AS link_code,
            l.link_type AS link_type,
            l.status AS status,
            COALESCE(ma.code, '') AS side_a_metro,
            COALESCE(mz.code, '') AS side_z_metro,
            COALESCE(c.code, '') AS contributor_code
        FROM dz_links_current l
        LEFT JOIN dz_devices_current da ON l.side_a_pk = da.pk
        LEFT JOIN dz_devices_current dz ON l.side_z_pk = dz.pk
        LEFT JOIN dz_metros_current ma ON da.metro_pk = ma.pk
        LEFT JOIN dz_metros_current mz ON dz.metro_pk = mz.pk
        LEFT JOIN dz_contributors_current c ON l.contributor_pk = c.pk
        WHERE 1 = 1
        """;

    /**
     * Links matching the filters, keyed by link pk in catalog order.
     * Kinds are ANDed; the values of one kind are ORed.
     */
    public Map<String, LinkMetadata> findLinks(Map<FilterKind, List<String>> filters) {
        StringBuilder sql = new StringBuilder(SELECT_LINKS);
        List<Object> args = new ArrayList<>();

        filters.forEach((kind, values) -> {
            if (values.isEmpty()) {
                return;
            }
            String in = SqlSupport.placeholders(values);
            switch (kind) {
                case METRO -> {
                    sql.append(" AND (ma.code IN (").append(in).append(") OR mz.code IN (").append(in).append("))");
                    args.addAll(values);
                    args.addAll(values);
                }
                case DEVICE -> {
                    sql.append(" AND (da.code IN (").append(in).append(") OR dz.code IN (").append(in).append("))");
                    args.addAll(values);
                    args.addAll(values);
                }
                case LINK -> {
                    sql.append(" AND l.code IN (").append(in).append(")");
                    args.addAll(values);
                }
                case CONTRIBUTOR -> {
                    sql.append(" AND c.code IN (").append(in).append(")");
                    args.addAll(values);
                }
            }
        });

        sql.append(" ORDER BY l.code");

        List<LinkMetadata> links = jdbcTemplate.query(sql.toString(), new LinkMetadataRowMapper(), args.toArray());

        Map<String, LinkMetadata> byPk = new LinkedHashMap<>();
        for (LinkMetadata link : links) {
            byPk.put(link.getLinkPk(), link);
        }

        log.debug("Resolved {} links for filters {}", byPk.size(), filters);
        return byPk;
    }

    private static class LinkMetadataRowMapper implements RowMapper<LinkMetadata> {
        @Override
        public LinkMetadata mapRow(ResultSet rs, int rowNum) throws SQLException {
            return LinkMetadata.builder()
                    .linkPk(rs.getString("link_pk"))
                    .linkCode(rs.getString("link_code"))
                    .linkType(rs.getString("link_type"))
                    .status(LinkStatus.fromString(rs.getString("status")))
                    .sideAMetro(rs.getString("side_a_metro"))
                    .sideZMetro(rs.getString("side_z_metro"))
                    .contributorCode(rs.getString("contributor_code"))
                    .build();
        }
    }
}
