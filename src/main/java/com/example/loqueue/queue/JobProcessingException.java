package com.example.loqueue.queue;

/**
 * Thrown out of a claim transaction when the processor fails, so the claim rolls back.
 */
public class JobProcessingException extends RuntimeException {
    private final String queueName;
    private final Long jobId;

    public JobProcessingException(String queueName, Long jobId, Throwable cause) {
        super("Processor failed for job " + jobId + " on queue " + queueName + ": " + cause.getMessage(), cause);
        this.queueName = queueName;
        this.jobId = jobId;
    }

    public String getQueueName() {
        return queueName;
    }

    public Long getJobId() {
        return jobId;
    }
}
