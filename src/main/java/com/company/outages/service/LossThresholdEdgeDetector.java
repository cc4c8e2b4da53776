package com.company.outages.service;

import com.company.outages.domain.LossBucket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns a link's loss buckets into threshold-crossing episodes.
 * <p>
 * Completed episodes end at the end of the last bucket at or above the threshold. An episode
 * still above threshold at the last bucket is closed at that bucket's end.
 */
class LossThresholdEdgeDetector implements ThresholdState.Listener {

    private final List<LossEpisode> episodes = new ArrayList<>();

    private Instant openStart;
    private double peak;
    private LossBucket previous;

    static List<LossEpisode> detect(List<LossBucket> buckets, double thresholdPct) {
        List<LossBucket> ordered = new ArrayList<>(buckets);
        ordered.sort(Comparator.comparing(LossBucket::getBucketStart));

        LossThresholdEdgeDetector detector = new LossThresholdEdgeDetector();
        ThresholdState state = ThresholdState.BELOW;
        for (LossBucket bucket : ordered) {
            state = state.on(bucket, thresholdPct, detector);
            detector.previous = bucket;
        }

        if (state == ThresholdState.ABOVE) {
            detector.close(detector.previous.getBucketEnd());
        }
        return detector.episodes;
    }

    /**
     * Walks back from the newest bucket to find where the loss episode that is still going on
     * began, and its peak. Below-threshold buckets newer than {@code recentSince} are skipped
     * before the walk starts, since the recent window can be above threshold while its last
     * bucket alone is not.
     *
     * @return empty when no at-or-above-threshold bucket is reachable
     */
    static Optional<LossEpisode> findOngoingStart(List<LossBucket> history, double thresholdPct, Instant recentSince) {
        List<LossBucket> ordered = new ArrayList<>(history);
        ordered.sort(Comparator.comparing(LossBucket::getBucketStart));

        int i = ordered.size() - 1;
        while (i >= 0 && !ordered.get(i).isAtOrAbove(thresholdPct)
                && ordered.get(i).getBucketEnd().isAfter(recentSince)) {
            i--;
        }
        if (i < 0 || !ordered.get(i).isAtOrAbove(thresholdPct)) {
            return Optional.empty();
        }

        double peakLoss = 0;
        Instant start = null;
        while (i >= 0 && ordered.get(i).isAtOrAbove(thresholdPct)) {
            LossBucket bucket = ordered.get(i);
            start = bucket.getBucketStart();
            peakLoss = Math.max(peakLoss, bucket.getLossPct());
            i--;
        }
        return Optional.of(new LossEpisode(start, null, peakLoss));
    }

    @Override
    public void rose(LossBucket bucket) {
        openStart = bucket.getBucketStart();
        peak = bucket.getLossPct();
    }

    @Override
    public void stayedAbove(LossBucket bucket) {
        peak = Math.max(peak, bucket.getLossPct());
    }

    @Override
    public void fell(LossBucket bucket) {
        close(previous.getBucketEnd());
    }

    private void close(Instant end) {
        episodes.add(new LossEpisode(openStart, end, peak));
        openStart = null;
        peak = 0;
    }
}
