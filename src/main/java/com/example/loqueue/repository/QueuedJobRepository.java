package com.example.loqueue.repository;

import com.example.loqueue.model.QueuedJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface QueuedJobRepository extends JpaRepository<QueuedJob, Long> {

    /**
     * Locks one job of the queue that is due at {@code now}, skipping rows other transactions
     * hold. The lock lasts until the surrounding transaction ends.
     *
     * @param queueName queue to claim from.
     * @param now       claim time.
     * @return the locked row, or empty when nothing is due or every due row is locked elsewhere.
     */
    @Query(value = """
        SELECT * FROM loqueue
        WHERE queue_name = :queueName
          AND (every_secs IS NULL
               OR last_run + every_secs * INTERVAL '1' SECOND < :now)
        LIMIT 1
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<QueuedJob> lockNextDue(@Param("queueName") String queueName, @Param("now") Instant now);

    @Modifying
    @Query("update QueuedJob j set j.lastRun = :lastRun where j.id = :id")
    int updateLastRun(@Param("id") Long id, @Param("lastRun") Instant lastRun);

    @Modifying
    @Query("delete from QueuedJob j where j.id = :id")
    int deleteJobById(@Param("id") Long id);

    long countByQueueName(String queueName);

    Optional<QueuedJob> findByIdAndQueueName(Long id, String queueName);
}
