package com.example.loqueue.queue;

/**
 * Signals a call the queue refuses to perform, such as waiting for a result from inside a
 * transaction.
 */
public class JobUsageException extends IllegalStateException {
    public JobUsageException(String message) {
        super(message);
    }
}
