package com.example.loqueue.queue;

import com.example.loqueue.model.QueuedJob;
import com.example.loqueue.service.PayloadCodec;
import com.example.loqueue.service.QueueStore;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A named queue: enqueues jobs and runs claim loops over them. Obtain instances from
 * {@link QueueFactory}. Several instances (in one or many processes) may serve the same queue name;
 * each one only shuts down the loops it started itself.
 */
public class Queue {
    private static final Logger LOGGER = LoggerFactory.getLogger(Queue.class);

    private final String name;
    private final QueueStore store;
    private final PayloadCodec codec;
    private final TransactionTemplate txTemplate;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration pollInterval;

    private final List<ClaimLoop> loops = new CopyOnWriteArrayList<>();

    Queue(String name,
          QueueStore store,
          PayloadCodec codec,
          TransactionTemplate txTemplate,
          TaskScheduler scheduler,
          Clock clock,
          Duration pollInterval) {
        this.name = name;
        this.store = store;
        this.codec = codec;
        this.txTemplate = txTemplate;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    public String getName() {
        return name;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public JobHandle add(@Nullable Object data) {
        return add(data, JobOptions.defaults());
    }

    /**
     * Adds a one-shot or recurring job. A recurring job that asks to keep its result is corrected
     * to discard it, with a warning.
     *
     * @param data    JSON-serializable payload handed to the processor.
     * @param options interval and result retention.
     * @return handle for the new job.
     */
    public JobHandle add(@Nullable Object data, JobOptions options) {
        boolean deleteOnAcknowledged = !options.retainsResult();
        if (options.isRecurring() && !deleteOnAcknowledged) {
            LOGGER.warn("deleteOnAcknowledged can only be false for one-shot jobs; results of recurring jobs are always "
                    + "discarded so they cannot pile up. Queue {} stores this job with deleteOnAcknowledged=true; "
                    + "hand results on from the processor instead.", name);
            deleteOnAcknowledged = true;
        }
        QueuedJob row = store.insert(name, codec.encode(data), options.everySecs(), deleteOnAcknowledged, clock.instant());
        return new JobHandle(row.getId(), store, codec, pollInterval);
    }

    /**
     * Returns a handle for a job id without checking that the job exists.
     */
    public JobHandle getJob(Long id) {
        return new JobHandle(id, store, codec, pollInterval);
    }

    public long pendingCount() {
        return store.countJobs(name);
    }

    public ClaimLoop process(JobProcessor processor) {
        return process(processor, ProcessingErrorHandler.logging());
    }

    /**
     * Starts a claim loop for this queue. Every call starts another loop; they compete for jobs
     * through the store's row locks.
     *
     * @param processor    callback run for each claimed job.
     * @param errorHandler receives failed iterations.
     * @return the running loop.
     */
    public ClaimLoop process(JobProcessor processor, ProcessingErrorHandler errorHandler) {
        ClaimLoop loop = new ClaimLoop(name, processor, errorHandler, store, codec, txTemplate, scheduler, clock, pollInterval);
        loops.add(loop);
        loop.start();
        LOGGER.info("Claim loop started on queue {} (loops={}, pollInterval={}ms)", name, loops.size(), pollInterval.toMillis());
        return loop;
    }

    /**
     * Cancels every loop this instance started. Jobs already claimed finish normally.
     */
    public void shutdown() {
        List<ClaimLoop> current = List.copyOf(loops);
        current.forEach(ClaimLoop::cancel);
        loops.removeAll(current);
        LOGGER.info("Queue {} shut down {} claim loop(s)", name, current.size());
    }

    public int activeLoops() {
        return loops.size();
    }
}
