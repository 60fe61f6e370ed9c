package com.example.loqueue.queue;

import com.example.loqueue.config.QueueProperties;
import com.example.loqueue.service.PayloadCodec;
import com.example.loqueue.service.QueueStore;
import jakarta.annotation.Nullable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Creates {@link Queue} instances wired to the shared store, scheduler and clock.
 */
@Component
public class QueueFactory {
    private final QueueStore store;
    private final PayloadCodec codec;
    private final TransactionTemplate txTemplate;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final QueueProperties properties;

    public QueueFactory(QueueStore store,
                        PayloadCodec codec,
                        TransactionTemplate txTemplate,
                        @Qualifier("queueTaskScheduler") TaskScheduler scheduler,
                        Clock clock,
                        QueueProperties properties) {
        this.store = store;
        this.codec = codec;
        this.txTemplate = txTemplate;
        this.scheduler = scheduler;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Returns a new queue instance for {@code name} polling at {@code loqueue.poll-interval}.
     * Instances are not cached, so each one owns the loops it starts.
     */
    public Queue queue(String name) {
        return queue(name, null);
    }

    /**
     * Returns a new queue instance for {@code name} with its own poll interval.
     *
     * @param name         queue name.
     * @param pollInterval delay between idle claim attempts and result polls; {@code null} uses
     *                     {@code loqueue.poll-interval}.
     */
    public Queue queue(String name, @Nullable Duration pollInterval) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Queue name is required");
        }
        if (pollInterval != null && (pollInterval.isZero() || pollInterval.isNegative())) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        Duration interval = pollInterval != null ? pollInterval : properties.getPollInterval();
        return new Queue(name.trim(), store, codec, txTemplate, scheduler, clock, interval);
    }
}
