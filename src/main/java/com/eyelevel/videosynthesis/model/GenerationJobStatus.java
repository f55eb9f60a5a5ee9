package com.eyelevel.videosynthesis.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a locally tracked generation job. Immutable; every state change produces a new
 * snapshot.
 */
public record GenerationJobStatus(
        UUID jobId,
        GenerationJobType jobType,
        GenerationJobState state,
        String message,
        String output,
        Instant createdAt,
        Instant updatedAt
) {

    public static GenerationJobStatus queued(UUID jobId, GenerationJobType jobType, Instant now) {
        return new GenerationJobStatus(jobId, jobType, GenerationJobState.QUEUED, "Job accepted", null, now, now);
    }

    public GenerationJobStatus withState(GenerationJobState newState, String newMessage, String newOutput, Instant now) {
        return new GenerationJobStatus(jobId, jobType, newState, newMessage, newOutput, createdAt, now);
    }
}
