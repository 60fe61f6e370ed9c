package com.example.loqueue.queue;

import com.example.loqueue.model.QueuedJob;
import com.example.loqueue.service.PayloadCodec;
import com.example.loqueue.service.QueueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One worker loop started by {@link Queue#process}.
 *
 * <p>Every iteration is a single transaction: lock one due job with a skip-locked read, run the
 * processor, then reschedule, delete or record a result. The next iteration is scheduled right
 * away after a processed job and after the poll interval otherwise.</p>
 *
 * <p>{@link #cancel()} is observed between iterations only; a job already claimed runs to
 * completion.</p>
 */
public class ClaimLoop {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClaimLoop.class);

    private final String queueName;
    private final JobProcessor processor;
    private final ProcessingErrorHandler errorHandler;
    private final QueueStore store;
    private final PayloadCodec codec;
    private final TransactionTemplate txTemplate;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Duration pollInterval;

    // guards inIteration, next and the decision to reschedule
    private final Object lock = new Object();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private boolean inIteration;
    private ScheduledFuture<?> next;

    ClaimLoop(String queueName,
              JobProcessor processor,
              ProcessingErrorHandler errorHandler,
              QueueStore store,
              PayloadCodec codec,
              TransactionTemplate txTemplate,
              TaskScheduler scheduler,
              Clock clock,
              Duration pollInterval) {
        this.queueName = queueName;
        this.processor = processor;
        this.errorHandler = errorHandler;
        this.store = store;
        this.codec = codec;
        this.txTemplate = txTemplate;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    void start() {
        synchronized (lock) {
            scheduleIn(Duration.ZERO);
        }
    }

    /**
     * Asks the loop to stop before its next iteration. A loop between iterations is stopped right
     * away; a running iteration finishes its job first.
     */
    public void cancel() {
        synchronized (lock) {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            if (next != null) {
                next.cancel(false);
            }
            if (!inIteration) {
                markStopped();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Waits until a cancelled loop has finished its last iteration.
     *
     * @return {@code true} if the loop stopped within the timeout.
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public String getQueueName() {
        return queueName;
    }

    void iterate() {
        synchronized (lock) {
            if (cancelled.get()) {
                markStopped();
                return;
            }
            inIteration = true;
        }
        ClaimOutcome outcome;
        try {
            outcome = runOnce();
        } catch (VirtualMachineError e) {
            synchronized (lock) {
                inIteration = false;
                cancelled.set(true);
                markStopped();
            }
            throw e;
        } catch (RuntimeException | Error e) {
            outcome = ClaimOutcome.FAILED;
            report(e);
        }
        synchronized (lock) {
            inIteration = false;
            if (cancelled.get()) {
                markStopped();
                return;
            }
            scheduleIn(outcome.delayBeforeNext(pollInterval));
        }
    }

    ClaimOutcome runOnce() {
        ClaimOutcome outcome = txTemplate.execute(status -> claimAndProcess());
        return outcome == null ? ClaimOutcome.IDLE : outcome;
    }

    private ClaimOutcome claimAndProcess() {
        Instant claimedAt = clock.instant();
        Optional<QueuedJob> claimed = store.claimNext(queueName, claimedAt);
        if (claimed.isEmpty()) {
            LOGGER.trace("Queue {} poll tick - no job claimed", queueName);
            return ClaimOutcome.IDLE;
        }

        QueuedJob job = claimed.get();
        LOGGER.debug("Acquired lock for job {} on queue {}", job.getId(), queueName);
        ClaimedJob claimedJob = new ClaimedJob(job, store, codec);
        Object out;
        try {
            out = processor.process(claimedJob);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            throw new JobProcessingException(queueName, job.getId(), e);
        }
        LOGGER.debug("Finished job {} on queue {}, releasing lock", job.getId(), queueName);

        if (job.isRecurring()) {
            if (!claimedJob.isRemoved()) {
                store.reschedule(job.getId(), RecurringSchedule.nextLastRun(job.getLastRun(), job.getEverySecs(), claimedAt));
            }
        } else {
            if (!job.isDeleteOnAcknowledged()) {
                store.recordResult(job.getId(), codec.encode(out), clock.instant());
            }
            if (!claimedJob.isRemoved()) {
                store.deleteJob(job.getId());
            }
        }
        return ClaimOutcome.PROCESSED;
    }

    private void report(Throwable e) {
        try {
            errorHandler.onError(queueName, e);
        } catch (RuntimeException handlerError) {
            LOGGER.error("Error handler for queue {} failed: {}", queueName, handlerError.toString(), handlerError);
        }
    }

    private void scheduleIn(Duration delay) {
        try {
            next = scheduler.schedule(this::iterate, scheduler.getClock().instant().plus(delay));
        } catch (TaskRejectedException e) {
            LOGGER.warn("Scheduler rejected next iteration for queue {}; loop stops: {}", queueName, e.getMessage());
            cancelled.set(true);
            markStopped();
        }
    }

    private void markStopped() {
        if (stopped.getCount() > 0) {
            LOGGER.info("Claim loop on queue {} stopped", queueName);
            stopped.countDown();
        }
    }
}
