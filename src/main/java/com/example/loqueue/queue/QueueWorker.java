package com.example.loqueue.queue;

/**
 * Declares a processor to run on application start. Register instances as beans.
 *
 * @param queueName   queue to claim from.
 * @param concurrency number of claim loops to start.
 * @param processor   callback for claimed jobs.
 */
public record QueueWorker(String queueName, int concurrency, JobProcessor processor) {

    public QueueWorker {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName is required");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor is required");
        }
    }
}
