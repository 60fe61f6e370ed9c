package com.example.loqueue.queue;

import com.example.loqueue.service.PayloadCodec;
import com.example.loqueue.service.QueueStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Reference to a job row by id, returned by {@link Queue#add} and {@link Queue#getJob}.
 * Processors receive a {@link ClaimedJob} instead.
 */
public final class JobHandle {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobHandle.class);

    private final Long id;
    private final QueueStore store;
    private final PayloadCodec codec;
    private final Duration pollInterval;

    JobHandle(Long id, QueueStore store, PayloadCodec codec, Duration pollInterval) {
        this.id = id;
        this.store = store;
        this.codec = codec;
        this.pollInterval = pollInterval;
    }

    public Long getId() {
        return id;
    }

    /**
     * Removes the job from the queue. Joins the caller's transaction when one is active.
     *
     * @return {@code true} if the job row existed.
     */
    public boolean remove() {
        return store.deleteJob(id);
    }

    /**
     * Blocks until the job's result is available, consumes it and deletes the job.
     *
     * <p>Only one-shot jobs added with {@code deleteOnAcknowledged = false} ever produce a result;
     * for any other job this never returns. There is no timeout.</p>
     *
     * @return the processor's return value as JSON.
     * @throws JobUsageException    if a transaction is active on this thread.
     * @throws InterruptedException if the waiting thread is interrupted.
     */
    public JsonNode done() throws InterruptedException {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new JobUsageException("done() cannot wait for job " + id + " inside a transaction; "
                    + "remove the job or hand its result on from the processor instead");
        }
        LOGGER.debug("Waiting for result of job {}", id);
        while (true) {
            Optional<String> result = store.consumeResult(id);
            if (result.isPresent()) {
                LOGGER.debug("Consumed result of job {}", id);
                return codec.decode(result.get());
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    public <T> T done(Class<T> type) throws InterruptedException {
        return codec.convert(done(), type);
    }

    @Override
    public String toString() {
        return "JobHandle{id=" + id + "}";
    }
}
