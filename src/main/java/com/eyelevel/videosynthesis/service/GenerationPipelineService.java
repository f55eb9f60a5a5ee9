package com.eyelevel.videosynthesis.service;

import com.eyelevel.videosynthesis.common.apiclient.omnihuman.OmniHumanApiClient;
import com.eyelevel.videosynthesis.common.apiclient.seedance.SeedanceApiClient;
import com.eyelevel.videosynthesis.config.VideoSynthesisConfig;
import com.eyelevel.videosynthesis.exception.SubmissionException;
import com.eyelevel.videosynthesis.model.GenerationJobType;
import com.eyelevel.videosynthesis.model.GenerationResult;
import com.eyelevel.videosynthesis.model.TaskHandle;
import com.eyelevel.videosynthesis.service.download.ArtifactDownloader;
import com.eyelevel.videosynthesis.service.download.DownloadResult;
import com.eyelevel.videosynthesis.service.polling.CancellationToken;
import com.eyelevel.videosynthesis.service.polling.PollOutcome;
import com.eyelevel.videosynthesis.service.polling.PollingProfiles;
import com.eyelevel.videosynthesis.service.polling.TaskPoller;
import com.eyelevel.videosynthesis.service.polling.TaskStatusSource;
import com.eyelevel.videosynthesis.service.submission.OmniHumanTaskRequest;
import com.eyelevel.videosynthesis.service.submission.OmniHumanTaskSubmitter;
import com.eyelevel.videosynthesis.service.submission.SeedanceTaskRequest;
import com.eyelevel.videosynthesis.service.submission.SeedanceTaskSubmitter;
import com.eyelevel.videosynthesis.service.submission.TaskSubmitter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Runs one generation job end to end on the calling thread: submit, poll until terminal, and
 * download the artifact when the job produces one.
 *
 * <p>Every failure along the way becomes a failed {@link GenerationResult}. Configuration and
 * signing errors are the exception: they propagate, since retrying or resubmitting cannot fix
 * them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationPipelineService {

    private final OmniHumanTaskSubmitter omniHumanTaskSubmitter;
    private final SeedanceTaskSubmitter seedanceTaskSubmitter;
    private final OmniHumanApiClient omniHumanApiClient;
    private final SeedanceApiClient seedanceApiClient;
    private final TaskPoller taskPoller;
    private final PollingProfiles pollingProfiles;
    private final ArtifactDownloader artifactDownloader;
    private final VideoSynthesisConfig videoSynthesisConfig;

    /**
     * Checks whether the image contains a usable human subject.
     *
     * @return on success, the subject id as output
     */
    public GenerationResult identifySubject(String imageUrl, CancellationToken cancellationToken) {
        return run(GenerationJobType.OMNIHUMAN_SUBJECT, omniHumanTaskSubmitter, OmniHumanTaskRequest.subject(imageUrl),
                   omniHumanStatusSource(GenerationJobType.OMNIHUMAN_SUBJECT), cancellationToken);
    }

    /**
     * Generates an audio-driven portrait video.
     *
     * @return on success, the local path of the downloaded video as output
     */
    public GenerationResult generateOmniHumanVideo(String imageUrl, String audioUrl, CancellationToken cancellationToken) {
        return run(GenerationJobType.OMNIHUMAN_VIDEO, omniHumanTaskSubmitter, OmniHumanTaskRequest.video(imageUrl, audioUrl),
                   omniHumanStatusSource(GenerationJobType.OMNIHUMAN_VIDEO), cancellationToken);
    }

    /**
     * Generates a video from a first frame, an optional last frame and a prompt.
     *
     * @return on success, the local path of the downloaded video as output
     */
    public GenerationResult generateSeedanceVideo(SeedanceTaskRequest request, CancellationToken cancellationToken) {
        return run(GenerationJobType.SEEDANCE_VIDEO, seedanceTaskSubmitter, request,
                   seedanceApiClient::fetchTask, cancellationToken);
    }

    private TaskStatusSource omniHumanStatusSource(GenerationJobType jobType) {
        return taskId -> omniHumanApiClient.fetchTaskResult(jobType.getReqKey(), taskId);
    }

    private <R> GenerationResult run(GenerationJobType jobType, TaskSubmitter<R> submitter, R request,
                                     TaskStatusSource statusSource, CancellationToken cancellationToken) {
        TaskHandle handle;
        try {
            handle = submitter.submit(request);
        } catch (SubmissionException | IllegalArgumentException e) {
            log.error("{} submission failed: {}", jobType, e.getMessage(), e);
            return GenerationResult.failure("Submission failed: " + e.getMessage());
        }

        String result;
        if (handle.isResolved()) {
            result = handle.result();
        } else {
            PollOutcome outcome = taskPoller.poll(handle.taskId(), statusSource, pollingProfiles.forJobType(jobType),
                                                  cancellationToken);
            if (!outcome.isSuccessful()) {
                return GenerationResult.failure(outcome.message());
            }
            result = outcome.result();
        }

        if (!jobType.isProducesArtifact()) {
            log.info("{} finished with result {}", jobType, result);
            return GenerationResult.success(result, "Subject identified: " + result);
        }
        if (cancellationToken.isCancellationRequested()) {
            return GenerationResult.failure("Cancelled before download");
        }

        Path target = outputPath(jobType, handle);
        DownloadResult download = artifactDownloader.download(result, target, cancellationToken);
        if (!download.successful()) {
            return GenerationResult.failure(download.failureReason());
        }
        return GenerationResult.success(download.path().toString(), "Video saved to " + download.path());
    }

    Path outputPath(GenerationJobType jobType, TaskHandle handle) {
        Path directory = Paths.get(videoSynthesisConfig.getOutputDir(), jobType.getFamily().getOutputDirectory());
        String fileName = switch (jobType.getFamily()) {
            case SEEDANCE -> "seedance_output_" + (handle.taskId() != null ? handle.taskId() : UUID.randomUUID()) + ".mp4";
            case OMNIHUMAN -> "omnihuman_video_" + UUID.randomUUID() + ".mp4";
        };
        return directory.resolve(fileName);
    }
}
