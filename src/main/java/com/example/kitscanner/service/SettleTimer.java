package com.example.kitscanner.service;

import java.time.Duration;

/**
 * Schedules the deferred callbacks the engines use for debounce and for hiding the undo action.
 * Never used for core state transitions.
 */
public interface SettleTimer {

    Handle schedule(Runnable task, Duration delay);

    interface Handle {

        /**
         * Cancels the task if it has not run yet. Safe to call more than once.
         */
        void cancel();
    }
}
