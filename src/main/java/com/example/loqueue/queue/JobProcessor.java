package com.example.loqueue.queue;

/**
 * Callback run for every claimed job.
 *
 * <p>It runs inside the claim transaction while the job row is locked. Anything it writes through
 * the same transaction (including {@link ClaimedJob#remove()}) commits or rolls back together with
 * the claim; side effects outside the database are not undone when it fails, and the job is
 * retried after the poll interval.</p>
 */
@FunctionalInterface
public interface JobProcessor {

    /**
     * @param job the claimed job.
     * @return the job result, JSON-encoded and kept only for one-shot jobs added with
     * {@code deleteOnAcknowledged = false}.
     * @throws Exception to roll the claim back.
     */
    Object process(ClaimedJob job) throws Exception;
}
