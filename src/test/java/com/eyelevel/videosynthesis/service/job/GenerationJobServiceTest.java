package com.eyelevel.videosynthesis.service.job;

import com.eyelevel.videosynthesis.exception.SigningException;
import com.eyelevel.videosynthesis.model.GenerationJobState;
import com.eyelevel.videosynthesis.model.GenerationJobStatus;
import com.eyelevel.videosynthesis.model.GenerationJobType;
import com.eyelevel.videosynthesis.model.GenerationResult;
import com.eyelevel.videosynthesis.service.GenerationPipelineService;
import com.eyelevel.videosynthesis.service.polling.CancellationToken;
import com.eyelevel.videosynthesis.service.submission.SeedanceTaskRequest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationJobServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final String IMAGE = "https://example.com/face.png";
    private static final String AUDIO = "https://example.com/voice.mp3";

    @Mock
    private GenerationPipelineService generationPipelineService;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<Runnable> queued = new ArrayList<>();

    @Test
    void completedJobExposesOutput() {
        GenerationJobService service = service(Runnable::run);
        when(generationPipelineService.identifySubject(eq(IMAGE), any(CancellationToken.class)))
                .thenReturn(GenerationResult.success("t-1", "Subject identified: t-1"));

        UUID jobId = service.submitSubjectIdentification(IMAGE);

        GenerationJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.jobType()).isEqualTo(GenerationJobType.OMNIHUMAN_SUBJECT);
        assertThat(status.state()).isEqualTo(GenerationJobState.COMPLETED);
        assertThat(status.output()).isEqualTo("t-1");
        assertThat(status.createdAt()).isEqualTo(NOW);
    }

    @Test
    void failedResultMarksJobFailed() {
        GenerationJobService service = service(Runnable::run);
        when(generationPipelineService.generateOmniHumanVideo(eq(IMAGE), eq(AUDIO), any(CancellationToken.class)))
                .thenReturn(GenerationResult.failure("Task timed out after 60 attempts"));

        UUID jobId = service.submitOmniHumanVideo(IMAGE, AUDIO);

        GenerationJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(GenerationJobState.FAILED);
        assertThat(status.message()).isEqualTo("Task timed out after 60 attempts");
        assertThat(status.output()).isNull();
    }

    @Test
    void seedanceRequestIsPassedThrough() {
        GenerationJobService service = service(Runnable::run);
        SeedanceTaskRequest request = new SeedanceTaskRequest(null, "a cat", IMAGE, null, "720p", 5, false, -1);
        when(generationPipelineService.generateSeedanceVideo(eq(request), any(CancellationToken.class)))
                .thenReturn(GenerationResult.success("output/seedance/seedance_output_cgt-1.mp4", "Video saved"));

        UUID jobId = service.submitSeedanceVideo(request);

        assertThat(service.getJobStatus(jobId)).get()
                .extracting(GenerationJobStatus::state).isEqualTo(GenerationJobState.COMPLETED);
    }

    @Test
    void jobWaitsQueuedUntilExecutorRunsIt() {
        GenerationJobService service = service(queued::add);

        UUID jobId = service.submitSubjectIdentification(IMAGE);

        assertThat(service.getJobStatus(jobId).orElseThrow().state()).isEqualTo(GenerationJobState.QUEUED);
        verifyNoInteractions(generationPipelineService);
    }

    @Test
    void jobCancelledBeforeStartNeverRuns() {
        GenerationJobService service = service(queued::add);
        UUID jobId = service.submitSubjectIdentification(IMAGE);

        assertThat(service.cancelJob(jobId)).isTrue();
        queued.forEach(Runnable::run);

        GenerationJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(GenerationJobState.CANCELLED);
        assertThat(status.message()).isEqualTo("Cancelled before start");
        verifyNoInteractions(generationPipelineService);
    }

    @Test
    void cancelledWhileRunningEndsCancelled() {
        GenerationJobService service = service(Runnable::run);
        when(generationPipelineService.generateOmniHumanVideo(eq(IMAGE), eq(AUDIO), any(CancellationToken.class)))
                .thenAnswer(invocation -> {
                    CancellationToken token = invocation.getArgument(2);
                    token.cancel();
                    return GenerationResult.failure("Polling cancelled after 3 attempts");
                });

        UUID jobId = service.submitOmniHumanVideo(IMAGE, AUDIO);

        assertThat(service.getJobStatus(jobId).orElseThrow().state()).isEqualTo(GenerationJobState.CANCELLED);
    }

    @Test
    void signingErrorMessageIsKept() {
        GenerationJobService service = service(Runnable::run);
        when(generationPipelineService.identifySubject(eq(IMAGE), any(CancellationToken.class)))
                .thenThrow(new SigningException("Request has no host"));

        UUID jobId = service.submitSubjectIdentification(IMAGE);

        GenerationJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(GenerationJobState.FAILED);
        assertThat(status.message()).isEqualTo("Request has no host");
    }

    @Test
    void unexpectedErrorIsHiddenBehindGenericMessage() {
        GenerationJobService service = service(Runnable::run);
        when(generationPipelineService.identifySubject(eq(IMAGE), any(CancellationToken.class)))
                .thenThrow(new IllegalStateException("boom"));

        UUID jobId = service.submitSubjectIdentification(IMAGE);

        GenerationJobStatus status = service.getJobStatus(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(GenerationJobState.FAILED);
        assertThat(status.message()).isEqualTo("Generation failed. Check server logs.");
    }

    @Test
    void rejectedJobIsMarkedFailed() {
        GenerationJobService service = service(task -> {
            throw new TaskRejectedException("queue full");
        });

        UUID jobId = service.submitSubjectIdentification(IMAGE);

        assertThat(service.getJobStatus(jobId).orElseThrow().state()).isEqualTo(GenerationJobState.FAILED);
        verifyNoInteractions(generationPipelineService);
    }

    @Test
    void unknownJobIsAbsent() {
        GenerationJobService service = service(Runnable::run);
        UUID unknown = UUID.randomUUID();

        assertThat(service.getJobStatus(unknown)).isEmpty();
        assertThat(service.cancelJob(unknown)).isFalse();
    }

    @Test
    void eachJobGetsItsOwnToken() {
        GenerationJobService service = service(queued::add);
        UUID first = service.submitSubjectIdentification(IMAGE);
        UUID second = service.submitSubjectIdentification(IMAGE);
        when(generationPipelineService.identifySubject(eq(IMAGE), any(CancellationToken.class)))
                .thenReturn(GenerationResult.success("t-2", "Subject identified: t-2"));

        service.cancelJob(first);
        queued.forEach(Runnable::run);

        assertThat(service.getJobStatus(first).orElseThrow().state()).isEqualTo(GenerationJobState.CANCELLED);
        assertThat(service.getJobStatus(second).orElseThrow().state()).isEqualTo(GenerationJobState.COMPLETED);
        verify(generationPipelineService).identifySubject(eq(IMAGE), any(CancellationToken.class));
    }

    private GenerationJobService service(TaskExecutor executor) {
        return new GenerationJobService(generationPipelineService, executor, clock);
    }
}
