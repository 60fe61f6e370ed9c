package com.example.loqueue.queue;

import jakarta.annotation.Nullable;

import java.time.Duration;
import java.time.Instant;

public final class RecurringSchedule {
    private RecurringSchedule() {
    }

    /**
     * Computes the {@code last_run} a recurring job gets after a claim at {@code now}.
     *
     * <p>A job more than one interval behind advances by exactly one interval, so it stays due and
     * catches up one run per claim. Otherwise it restarts its interval from {@code now}.</p>
     *
     * @param lastRun   previous {@code last_run}.
     * @param everySecs interval in seconds.
     * @param now       claim time.
     * @return new {@code last_run}.
     */
    public static Instant nextLastRun(@Nullable Instant lastRun, int everySecs, Instant now) {
        if (lastRun == null) {
            return now;
        }
        Duration interval = Duration.ofSeconds(everySecs);
        Instant nextFire = lastRun.plus(interval);
        if (!nextFire.isAfter(now.minus(interval))) {
            return nextFire;
        }
        return now;
    }
}
