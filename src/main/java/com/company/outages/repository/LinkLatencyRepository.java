package com.company.outages.repository;

import com.company.outages.domain.LinkLastSeen;
import com.company.outages.domain.LossBucket;
import com.company.outages.domain.RecentLoss;
import com.company.outages.domain.SampleBucket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reader for per-link latency probes. A probe counts as lossy when it was flagged lost or
 * returned a zero RTT. Loss is always a percentage: lossy * 100.0 / total.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LinkLatencyRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String LOSS_PCT = "countIf(lat.loss = true OR lat.rtt_us = 0) * 100.0 / count(*)";
    private static final String BUCKET = "toStartOfInterval(lat.event_ts, INTERVAL 5 MINUTE)";

    /**
     * 5-minute loss buckets for the given links since {@code since}, buckets with fewer than
     * {@code minSamples} probes dropped
     */
    public List<LossBucket> findLossBuckets(Collection<String> linkPks, Instant since, int minSamples) {
        if (linkPks.isEmpty()) {
            return List.of();
        }

        String sql = String.format("""
            SELECT
                lat.link_pk AS link_pk,
                %s AS bucket,
                %s AS loss_pct,
                count(*) AS sample_count
            FROM fact_dz_device_link_latency lat
            WHERE lat.event_ts >= ?
              AND lat.link_pk IN (%s)
            GROUP BY lat.link_pk, bucket
            HAVING count(*) >= ?
            ORDER BY lat.link_pk, bucket
            """, BUCKET, LOSS_PCT, SqlSupport.placeholders(linkPks));

        List<Object> args = new ArrayList<>();
        args.add(SqlSupport.timestamp(since));
        args.addAll(linkPks);
        args.add(minSamples);

        List<LossBucket> buckets = jdbcTemplate.query(sql, new LossBucketRowMapper(), args.toArray());
        log.debug("Loaded {} loss buckets for {} links since {}", buckets.size(), linkPks.size(), since);
        return buckets;
    }

    /**
     * 5-minute loss buckets of one link since {@code since}, oldest first
     */
    public List<LossBucket> findLossHistory(String linkPk, Instant since, int minSamples) {
        String sql = String.format("""
            SELECT
                lat.link_pk AS link_pk,
                %s AS bucket,
                %s AS loss_pct,
                count(*) AS sample_count
            FROM fact_dz_device_link_latency lat
            WHERE lat.link_pk = ?
              AND lat.event_ts >= ?
            GROUP BY lat.link_pk, bucket
            HAVING count(*) >= ?
            ORDER BY bucket
            """, BUCKET, LOSS_PCT);

        return jdbcTemplate.query(sql, new LossBucketRowMapper(),
                linkPk, SqlSupport.timestamp(since), minSamples);
    }

    /**
     * Loss over the whole window since {@code since}, one row per link with at least
     * {@code minSamples} probes
     */
    public List<RecentLoss> findRecentLoss(Collection<String> linkPks, Instant since, int minSamples) {
        if (linkPks.isEmpty()) {
            return List.of();
        }

        String sql = String.format("""
            SELECT
                lat.link_pk AS link_pk,
                %s AS loss_pct,
                count(*) AS sample_count,
                max(lat.event_ts) AS last_seen
            FROM fact_dz_device_link_latency lat
            WHERE lat.event_ts >= ?
              AND lat.link_pk IN (%s)
            GROUP BY lat.link_pk
            HAVING count(*) >= ?
            """, LOSS_PCT, SqlSupport.placeholders(linkPks));

        List<Object> args = new ArrayList<>();
        args.add(SqlSupport.timestamp(since));
        args.addAll(linkPks);
        args.add(minSamples);

        return jdbcTemplate.query(sql, (rs, rowNum) -> RecentLoss.builder()
                .linkPk(rs.getString("link_pk"))
                .lossPct(rs.getDouble("loss_pct"))
                .sampleCount(rs.getLong("sample_count"))
                .lastSeen(SqlSupport.getInstant(rs, "last_seen"))
                .build(), args.toArray());
    }

    /**
     * Latest probe time per link since {@code since}; links without probes are absent
     */
    public List<LinkLastSeen> findLastSeen(Collection<String> linkPks, Instant since) {
        if (linkPks.isEmpty()) {
            return List.of();
        }

        String sql = String.format("""
            SELECT lat.link_pk AS link_pk, max(lat.event_ts) AS last_seen
            FROM fact_dz_device_link_latency lat
            WHERE lat.event_ts >= ?
              AND lat.link_pk IN (%s)
            GROUP BY lat.link_pk
            """, SqlSupport.placeholders(linkPks));

        List<Object> args = new ArrayList<>();
        args.add(SqlSupport.timestamp(since));
        args.addAll(linkPks);

        return jdbcTemplate.query(sql, (rs, rowNum) -> new LinkLastSeen(
                rs.getString("link_pk"),
                SqlSupport.getInstant(rs, "last_seen")), args.toArray());
    }

    /**
     * Distinct 5-minute buckets holding at least one probe, per link
     */
    public List<SampleBucket> findSampleBuckets(Collection<String> linkPks, Instant since) {
        if (linkPks.isEmpty()) {
            return List.of();
        }

        String sql = String.format("""
            SELECT lat.link_pk AS link_pk, %s AS bucket
            FROM fact_dz_device_link_latency lat
            WHERE lat.event_ts >= ?
              AND lat.link_pk IN (%s)
            GROUP BY lat.link_pk, bucket
            ORDER BY lat.link_pk, bucket
            """, BUCKET, SqlSupport.placeholders(linkPks));

        List<Object> args = new ArrayList<>();
        args.add(SqlSupport.timestamp(since));
        args.addAll(linkPks);

        return jdbcTemplate.query(sql, (rs, rowNum) -> new SampleBucket(
                rs.getString("link_pk"),
                SqlSupport.getInstant(rs, "bucket")), args.toArray());
    }

    private static class LossBucketRowMapper implements RowMapper<LossBucket> {
        @Override
        public LossBucket mapRow(ResultSet rs, int rowNum) throws SQLException {
            return LossBucket.builder()
                    .linkPk(rs.getString("link_pk"))
                    .bucketStart(SqlSupport.getInstant(rs, "bucket"))
                    .lossPct(rs.getDouble("loss_pct"))
                    .sampleCount(rs.getLong("sample_count"))
                    .build();
        }
    }
}
