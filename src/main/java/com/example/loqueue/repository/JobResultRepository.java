package com.example.loqueue.repository;

import com.example.loqueue.model.JobResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Repository for results of one-shot jobs awaiting acknowledgment.
 */
public interface JobResultRepository extends JpaRepository<JobResult, Long> {

    Optional<JobResult> findFirstByJobIdOrderByIdAsc(Long jobId);

    /**
     * Deletes a result row by primary key.
     *
     * @param id result row id.
     * @return number of rows removed; only the caller that sees {@code 1} owns the result.
     */
    @Modifying
    @Query("delete from JobResult r where r.id = :id")
    int deleteResultById(@Param("id") Long id);

    long countByJobId(Long jobId);
}
