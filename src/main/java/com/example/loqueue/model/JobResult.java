package com.example.loqueue.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Result of a completed one-shot job, kept until the first waiter consumes it.
 * {@code jobId} refers to the job by value; the job row may already be gone.
 */
@Entity
@Table(
        name = "loqueue_results",
        indexes = {
                @Index(name = "idx_loqueue_results_job", columnList = "job_id")
        }
)
public class JobResult {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "result")
    private String result;

    @Column(name = "time_run")
    private Instant timeRun;

    protected JobResult() {
    }

    public JobResult(Long jobId, String result, Instant timeRun) {
        this.jobId = jobId;
        this.result = result;
        this.timeRun = timeRun;
    }

    public Long getId() {
        return id;
    }

    public Long getJobId() {
        return jobId;
    }

    public String getResult() {
        return result;
    }

    public Instant getTimeRun() {
        return timeRun;
    }
}
