package com.eyelevel.videosynthesis.service.job;

import com.eyelevel.videosynthesis.exception.ConfigurationException;
import com.eyelevel.videosynthesis.exception.SigningException;
import com.eyelevel.videosynthesis.model.GenerationJobState;
import com.eyelevel.videosynthesis.model.GenerationJobStatus;
import com.eyelevel.videosynthesis.model.GenerationJobType;
import com.eyelevel.videosynthesis.model.GenerationResult;
import com.eyelevel.videosynthesis.service.GenerationPipelineService;
import com.eyelevel.videosynthesis.service.polling.CancellationToken;
import com.eyelevel.videosynthesis.service.submission.SeedanceTaskRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Accepts generation jobs, runs each on the application task executor and tracks its state in
 * memory. Every job owns its {@link CancellationToken}; nothing mutable is shared between jobs.
 */
@Slf4j
@Service
public class GenerationJobService {

    private final GenerationPipelineService generationPipelineService;
    private final TaskExecutor taskExecutor;
    private final Clock clock;
    private final Map<UUID, TrackedJob> jobs = new ConcurrentHashMap<>();

    public GenerationJobService(GenerationPipelineService generationPipelineService,
                                @Qualifier("applicationTaskExecutor") TaskExecutor taskExecutor,
                                Clock clock) {
        this.generationPipelineService = generationPipelineService;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    public UUID submitSubjectIdentification(String imageUrl) {
        return submit(GenerationJobType.OMNIHUMAN_SUBJECT,
                      token -> generationPipelineService.identifySubject(imageUrl, token));
    }

    public UUID submitOmniHumanVideo(String imageUrl, String audioUrl) {
        return submit(GenerationJobType.OMNIHUMAN_VIDEO,
                      token -> generationPipelineService.generateOmniHumanVideo(imageUrl, audioUrl, token));
    }

    public UUID submitSeedanceVideo(SeedanceTaskRequest request) {
        return submit(GenerationJobType.SEEDANCE_VIDEO,
                      token -> generationPipelineService.generateSeedanceVideo(request, token));
    }

    public Optional<GenerationJobStatus> getJobStatus(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(TrackedJob::status);
    }

    /**
     * Requests cancellation. A job that has not started yet never starts; a running job stops at
     * its next poll or download chunk. Finished jobs are left as they are.
     *
     * @return false if no job with this id exists
     */
    public boolean cancelJob(UUID jobId) {
        TrackedJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        job.token().cancel();
        log.info("Cancellation requested for job {}", jobId);
        return true;
    }

    private UUID submit(GenerationJobType jobType, Function<CancellationToken, GenerationResult> work) {
        UUID jobId = UUID.randomUUID();
        jobs.put(jobId, new TrackedJob(new CancellationToken(), GenerationJobStatus.queued(jobId, jobType, clock.instant())));
        log.info("Accepted {} job {}", jobType, jobId);
        try {
            taskExecutor.execute(() -> process(jobId, work));
        } catch (TaskRejectedException e) {
            log.error("Job {} rejected by the executor", jobId, e);
            update(jobId, GenerationJobState.FAILED, "Too many jobs in progress, try again later", null);
        }
        return jobId;
    }

    private void process(UUID jobId, Function<CancellationToken, GenerationResult> work) {
        CancellationToken token = jobs.get(jobId).token();
        if (token.isCancellationRequested()) {
            update(jobId, GenerationJobState.CANCELLED, "Cancelled before start", null);
            return;
        }
        update(jobId, GenerationJobState.RUNNING, "Generating", null);
        try {
            GenerationResult result = work.apply(token);
            if (result.successful()) {
                update(jobId, GenerationJobState.COMPLETED, result.message(), result.output());
            } else if (token.isCancellationRequested()) {
                update(jobId, GenerationJobState.CANCELLED, result.message(), null);
            } else {
                update(jobId, GenerationJobState.FAILED, result.message(), null);
            }
        } catch (ConfigurationException | SigningException e) {
            log.error("Job {} cannot run: {}", jobId, e.getMessage());
            update(jobId, GenerationJobState.FAILED, e.getMessage(), null);
        } catch (Exception e) {
            log.error("Generation job {} failed", jobId, e);
            update(jobId, GenerationJobState.FAILED, "Generation failed. Check server logs.", null);
        }
    }

    private void update(UUID jobId, GenerationJobState state, String message, String output) {
        TrackedJob updated = jobs.computeIfPresent(jobId, (ignored, current) ->
                new TrackedJob(current.token(), current.status().withState(state, message, output, clock.instant())));
        if (updated != null && state.isFinished()) {
            log.info("Job {} finished as {}: {}", jobId, state, message);
        }
    }

    private record TrackedJob(CancellationToken token, GenerationJobStatus status) {
    }
}
