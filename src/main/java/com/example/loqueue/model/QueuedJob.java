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
 * One pending unit of work. A row with {@code everySecs} set is recurring and is only ever
 * rescheduled; a row without it is deleted after its single successful claim.
 */
@Entity
@Table(
        name = "loqueue",
        indexes = {
                @Index(name = "idx_loqueue_queue_last_run", columnList = "queue_name, last_run")
        }
)
public class QueuedJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    // JSON text written by PayloadCodec
    @Column(name = "input_data")
    private String inputData;

    @Column(name = "queue_name", nullable = false)
    private String queueName;

    @Column(name = "every_secs")
    private Integer everySecs;

    @Column(name = "last_run")
    private Instant lastRun;

    @Column(name = "delete_on_acknowledged", nullable = false)
    private boolean deleteOnAcknowledged = true;

    protected QueuedJob() {
    }

    public QueuedJob(String queueName, String inputData, Integer everySecs, boolean deleteOnAcknowledged, Instant lastRun) {
        this.queueName = queueName;
        this.inputData = inputData;
        this.everySecs = everySecs;
        this.deleteOnAcknowledged = deleteOnAcknowledged;
        this.lastRun = lastRun;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getInputData() {
        return inputData;
    }

    public String getQueueName() {
        return queueName;
    }

    public Integer getEverySecs() {
        return everySecs;
    }

    public Instant getLastRun() {
        return lastRun;
    }

    public boolean isDeleteOnAcknowledged() {
        return deleteOnAcknowledged;
    }

    public boolean isRecurring() {
        return everySecs != null;
    }
}
