package com.example.loqueue.queue;

import jakarta.annotation.Nullable;

/**
 * Options for {@link Queue#add(Object, JobOptions)}.
 *
 * @param everySecs            repeat interval in seconds; {@code null} for a one-shot job.
 * @param deleteOnAcknowledged {@code false} keeps the processor's return value until
 *                             {@link JobHandle#done()} consumes it; {@code null} means the default
 *                             ({@code true}).
 */
public record JobOptions(@Nullable Integer everySecs, @Nullable Boolean deleteOnAcknowledged) {

    public JobOptions {
        if (everySecs != null && everySecs <= 0) {
            throw new IllegalArgumentException("everySecs must be positive, got " + everySecs);
        }
    }

    public static JobOptions defaults() {
        return new JobOptions(null, null);
    }

    public static JobOptions every(int seconds) {
        return new JobOptions(seconds, null);
    }

    /** One-shot job whose result is kept for {@link JobHandle#done()}. */
    public static JobOptions awaitingResult() {
        return new JobOptions(null, false);
    }

    public JobOptions withDeleteOnAcknowledged(boolean value) {
        return new JobOptions(everySecs, value);
    }

    public boolean isRecurring() {
        return everySecs != null;
    }

    public boolean retainsResult() {
        return Boolean.FALSE.equals(deleteOnAcknowledged);
    }
}
