package com.example.loqueue.queue;

import com.example.loqueue.model.QueuedJob;
import com.example.loqueue.service.PayloadCodec;
import com.example.loqueue.service.QueueStore;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A job as seen by a {@link JobProcessor}, bound to the claim transaction that locked it.
 * Has no {@code done()}: a job's result cannot exist before its own claim commits.
 */
public final class ClaimedJob {
    private final QueuedJob row;
    private final QueueStore store;
    private final PayloadCodec codec;
    private JsonNode data;
    private boolean removed;

    ClaimedJob(QueuedJob row, QueueStore store, PayloadCodec codec) {
        this.row = row;
        this.store = store;
        this.codec = codec;
    }

    public Long id() {
        return row.getId();
    }

    public String queueName() {
        return row.getQueueName();
    }

    public boolean isRecurring() {
        return row.isRecurring();
    }

    public JsonNode data() {
        if (data == null) {
            data = codec.decode(row.getInputData());
        }
        return data;
    }

    public <T> T dataAs(Class<T> type) {
        return codec.convert(data(), type);
    }

    /**
     * Deletes the job within the claim transaction. Must be called on the processor's thread; a
     * recurring job removed this way is not rescheduled.
     */
    public void remove() {
        store.deleteJob(row.getId());
        removed = true;
    }

    boolean isRemoved() {
        return removed;
    }
}
