package com.example.loqueue.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Starts the claim loops of every {@link QueueWorker} bean once the context is up and shuts them
 * down when it closes.
 */
@Component
public class QueueWorkerLifecycle implements SmartLifecycle {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueueWorkerLifecycle.class);

    private final QueueFactory queueFactory;
    private final List<QueueWorker> workers;
    private final List<Queue> started = new ArrayList<>();
    private volatile boolean running;

    public QueueWorkerLifecycle(QueueFactory queueFactory, ObjectProvider<QueueWorker> workers) {
        this.queueFactory = queueFactory;
        this.workers = workers.orderedStream().toList();
    }

    @Override
    public synchronized void start() {
        if (running) {
            LOGGER.warn("Queue workers already running; start() ignored.");
            return;
        }
        for (QueueWorker worker : workers) {
            Queue queue = queueFactory.queue(worker.queueName());
            for (int i = 0; i < worker.concurrency(); i++) {
                queue.process(worker.processor());
            }
            started.add(queue);
            LOGGER.info("Started {} claim loop(s) for queue {}", worker.concurrency(), worker.queueName());
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        started.forEach(Queue::shutdown);
        started.clear();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    List<Queue> startedQueues() {
        return List.copyOf(started);
    }
}
