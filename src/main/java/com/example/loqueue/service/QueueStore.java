package com.example.loqueue.service;

import com.example.loqueue.model.JobResult;
import com.example.loqueue.model.QueuedJob;
import com.example.loqueue.repository.JobResultRepository;
import com.example.loqueue.repository.QueuedJobRepository;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Transactional access to the job and result tables.
 *
 * <p>Claim-side operations require the caller's transaction, so the row lock taken by
 * {@link #claimNext} covers every write that follows it. The remaining operations join an active
 * transaction or run in their own.</p>
 */
@Service
public class QueueStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueueStore.class);

    private final QueuedJobRepository jobRepo;
    private final JobResultRepository resultRepo;

    public QueueStore(QueuedJobRepository jobRepo, JobResultRepository resultRepo) {
        this.jobRepo = jobRepo;
        this.resultRepo = resultRepo;
    }

    @Transactional
    public QueuedJob insert(String queueName, String inputData, @Nullable Integer everySecs,
                            boolean deleteOnAcknowledged, Instant now) {
        QueuedJob job = jobRepo.save(new QueuedJob(queueName, inputData, everySecs, deleteOnAcknowledged, now));
        LOGGER.debug("Inserted job id={} queue={} everySecs={}", job.getId(), queueName, everySecs);
        return job;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<QueuedJob> claimNext(String queueName, Instant now) {
        return jobRepo.lockNextDue(queueName, now);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void reschedule(Long jobId, Instant lastRun) {
        jobRepo.updateLastRun(jobId, lastRun);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordResult(Long jobId, String resultJson, Instant timeRun) {
        resultRepo.save(new JobResult(jobId, resultJson, timeRun));
    }

    /**
     * Deletes a job row.
     *
     * @param jobId job id.
     * @return {@code true} if a row was removed.
     */
    @Transactional
    public boolean deleteJob(Long jobId) {
        return jobRepo.deleteJobById(jobId) > 0;
    }

    /**
     * Consumes the result of a job at most once: the result row is deleted by primary key and only
     * the transaction whose delete removed it gets the value. The job row is deleted with it.
     *
     * @param jobId job id.
     * @return the result JSON, or empty if there is none yet or another waiter took it.
     */
    @Transactional
    public Optional<String> consumeResult(Long jobId) {
        Optional<JobResult> found = resultRepo.findFirstByJobIdOrderByIdAsc(jobId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        JobResult result = found.get();
        if (resultRepo.deleteResultById(result.getId()) == 0) {
            LOGGER.debug("Result id={} for job {} consumed by another waiter", result.getId(), jobId);
            return Optional.empty();
        }
        jobRepo.deleteJobById(jobId);
        return Optional.of(result.getResult() == null ? "null" : result.getResult());
    }

    @Transactional(readOnly = true)
    public Optional<QueuedJob> findJob(Long jobId, String queueName) {
        return jobRepo.findByIdAndQueueName(jobId, queueName);
    }

    @Transactional(readOnly = true)
    public long countJobs(String queueName) {
        return jobRepo.countByQueueName(queueName);
    }

    @Transactional(readOnly = true)
    public long countAllJobs() {
        return jobRepo.count();
    }

    @Transactional(readOnly = true)
    public long countAllResults() {
        return resultRepo.count();
    }
}
