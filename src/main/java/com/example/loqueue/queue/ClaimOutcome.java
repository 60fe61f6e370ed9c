package com.example.loqueue.queue;

import java.time.Duration;

enum ClaimOutcome {
    PROCESSED,
    IDLE,
    FAILED;

    /** Processed jobs drain the backlog without delay; idle and failed iterations back off. */
    Duration delayBeforeNext(Duration pollInterval) {
        return this == PROCESSED ? Duration.ZERO : pollInterval;
    }
}
