package com.example.loqueue.controller;

import com.example.loqueue.queue.JobHandle;
import com.example.loqueue.queue.JobOptions;
import com.example.loqueue.queue.QueueFactory;
import com.example.loqueue.service.PayloadCodec;
import com.example.loqueue.service.QueueStore;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

@RestController
@RequestMapping("/v1/queues/{queue}/jobs")
public class JobsController {
    private final QueueFactory queueFactory;
    private final QueueStore queueStore;
    private final PayloadCodec codec;

    public JobsController(QueueFactory queueFactory, QueueStore queueStore, PayloadCodec codec) {
        this.queueFactory = queueFactory;
        this.queueStore = queueStore;
        this.codec = codec;
    }

    public record EnqueueReq(JsonNode data, @Positive Integer everySecs, Boolean deleteOnAcknowledged) {}
    public record EnqueueRes(Long jobId) {}
    public record JobRes(
            Long id,
            String queue,
            JsonNode data,
            Integer everySecs,
            boolean deleteOnAcknowledged,
            Instant lastRun
    ) {}

    @Operation(summary = "Add a one-shot or recurring job to a queue")
    @ApiResponse(responseCode = "201", description = "Job stored")
    @ApiResponse(responseCode = "400", description = "Invalid request payload or non-positive interval")
    @PostMapping
    public ResponseEntity<EnqueueRes> enqueue(@PathVariable String queue, @Valid @RequestBody EnqueueReq req) {
        if (req == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "BODY_REQUIRED");
        }
        JobHandle handle = queueFactory.queue(queue)
                .add(req.data(), new JobOptions(req.everySecs(), req.deleteOnAcknowledged()));
        return ResponseEntity.status(HttpStatus.CREATED).body(new EnqueueRes(handle.getId()));
    }

    @Operation(summary = "Read a pending job")
    @ApiResponse(responseCode = "404", description = "No such job on this queue")
    @GetMapping("/{id}")
    public JobRes get(@PathVariable String queue, @PathVariable Long id) {
        var j = queueStore.findJob(id, queue)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        return new JobRes(
                j.getId(),
                j.getQueueName(),
                codec.decode(j.getInputData()),
                j.getEverySecs(),
                j.isDeleteOnAcknowledged(),
                j.getLastRun()
        );
    }

    @Operation(summary = "Remove a pending job")
    @ApiResponse(responseCode = "204", description = "Job removed")
    @ApiResponse(responseCode = "404", description = "No such job on this queue")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@PathVariable String queue, @PathVariable Long id) {
        if (queueStore.findJob(id, queue).isEmpty() || !queueFactory.queue(queue).getJob(id).remove()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
        }
        return ResponseEntity.noContent().build();
    }
}
