package com.example.loqueue.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives failures of claim iterations. The iteration has already been rolled back; the loop
 * retries after its poll interval once the handler returns.
 */
@FunctionalInterface
public interface ProcessingErrorHandler {

    void onError(String queueName, Throwable error);

    static ProcessingErrorHandler logging() {
        Logger logger = LoggerFactory.getLogger(ClaimLoop.class);
        return (queueName, error) ->
                logger.error("Claim on queue {} failed, retrying after poll interval: {}", queueName, error.toString(), error);
    }
}
