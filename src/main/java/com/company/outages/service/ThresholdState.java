package com.company.outages.service;

import com.company.outages.domain.LossBucket;

/**
 * Per-link edge detector state over an ordered loss bucket sequence
 */
enum ThresholdState {

    BELOW {
        @Override
        ThresholdState on(LossBucket bucket, double thresholdPct, Listener listener) {
            if (bucket.isAtOrAbove(thresholdPct)) {
                listener.rose(bucket);
                return ABOVE;
            }
            return BELOW;
        }
    },

    ABOVE {
        @Override
        ThresholdState on(LossBucket bucket, double thresholdPct, Listener listener) {
            if (bucket.isAtOrAbove(thresholdPct)) {
                listener.stayedAbove(bucket);
                return ABOVE;
            }
            listener.fell(bucket);
            return BELOW;
        }
    };

    abstract ThresholdState on(LossBucket bucket, double thresholdPct, Listener listener);

    interface Listener {
        void rose(LossBucket bucket);

        void stayedAbove(LossBucket bucket);

        void fell(LossBucket bucket);
    }
}
