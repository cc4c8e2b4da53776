package com.company.outages.service;

import com.company.outages.domain.StatusTransition;

/**
 * Per-link state while pairing status transitions into drain outages.
 * Each constant maps one transition to the follow-up state and tells the
 * {@link Listener} what happened to the interval being paired.
 */
enum DrainState {

    UP {
        @Override
        DrainState on(StatusTransition transition, Listener listener) {
            if (transition.isDrainStart()) {
                listener.opened(transition);
                return DRAINING;
            }
            // recoveries and sub-state changes of a drain that began before the window are ignored
            return UP;
        }
    },

    DRAINING {
        @Override
        DrainState on(StatusTransition transition, Listener listener) {
            if (transition.isRecovery()) {
                listener.closed(transition);
                return UP;
            }
            if (transition.isDrainedSubStateChange()) {
                listener.relabelled(transition);
                return DRAINING;
            }
            if (transition.isDrainStart()) {
                // activated -> drained without a recovery in between: the log lost an event
                listener.restarted(transition);
                return DRAINING;
            }
            return DRAINING;
        }
    };

    abstract DrainState on(StatusTransition transition, Listener listener);

    interface Listener {
        void opened(StatusTransition transition);

        void relabelled(StatusTransition transition);

        void closed(StatusTransition transition);

        void restarted(StatusTransition transition);
    }
}
