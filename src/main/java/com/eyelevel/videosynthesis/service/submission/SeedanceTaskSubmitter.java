package com.eyelevel.videosynthesis.service.submission;

import com.eyelevel.videosynthesis.common.apiclient.seedance.SeedanceApiClient;
import com.eyelevel.videosynthesis.config.VideoSynthesisConfig;
import com.eyelevel.videosynthesis.dto.seedance.request.SeedanceCreateTaskRequest;
import com.eyelevel.videosynthesis.dto.seedance.request.SeedanceCreateTaskRequest.ContentItem;
import com.eyelevel.videosynthesis.exception.SubmissionException;
import com.eyelevel.videosynthesis.exception.apiclient.ApiException;
import com.eyelevel.videosynthesis.model.TaskHandle;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Submits token-family image-to-video jobs. The generation parameters travel as a suffix on the
 * prompt text; the response's {@code id} is the task id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeedanceTaskSubmitter implements TaskSubmitter<SeedanceTaskRequest> {

    static final String FIRST_FRAME_ROLE = "first_frame";
    static final String LAST_FRAME_ROLE = "last_frame";

    private final SeedanceApiClient seedanceApiClient;
    private final VideoSynthesisConfig videoSynthesisConfig;

    @Override
    public TaskHandle submit(SeedanceTaskRequest request) {
        if (!StringUtils.hasText(request.imageUrl())) {
            throw new IllegalArgumentException("A first-frame image URL is required");
        }
        String model = StringUtils.hasText(request.model())
                ? request.model()
                : videoSynthesisConfig.getSeedance().getDefaultModel();

        String prompt = formatPrompt(request);
        log.info("Submitting image-to-video task with model '{}': {}", model, prompt);

        JsonNode response;
        try {
            response = seedanceApiClient.createTask(new SeedanceCreateTaskRequest(model, buildContent(request, prompt)));
        } catch (ApiException e) {
            throw new SubmissionException("Submission rejected with HTTP " + e.getStatusCode() + ": " + e.getMessage(), e);
        }

        String taskId = response.path("id").asText(null);
        if (!StringUtils.hasText(taskId)) {
            throw new SubmissionException("Submission response carries no task id");
        }
        log.info("Image-to-video task created with id {}", taskId);
        return TaskHandle.pending(taskId);
    }

    /**
     * Appends the generation parameters to the prompt, e.g.
     * {@code "a cat --resolution 720p --duration 5 --camerafixed false --seed 42"}. The seed is
     * left out when negative.
     */
    public static String formatPrompt(SeedanceTaskRequest request) {
        StringBuilder prompt = new StringBuilder(request.prompt() == null ? "" : request.prompt())
                .append(" --resolution ").append(request.resolution())
                .append(" --duration ").append(request.durationSeconds())
                .append(" --camerafixed ").append(request.cameraFixed());
        if (request.seed() >= 0) {
            prompt.append(" --seed ").append(request.seed());
        }
        return prompt.toString().strip();
    }

    private static List<ContentItem> buildContent(SeedanceTaskRequest request, String prompt) {
        List<ContentItem> content = new ArrayList<>();
        content.add(ContentItem.text(prompt));
        boolean hasEndFrame = StringUtils.hasText(request.endFrameImageUrl());
        content.add(ContentItem.image(request.imageUrl(), hasEndFrame ? FIRST_FRAME_ROLE : null));
        if (hasEndFrame) {
            content.add(ContentItem.image(request.endFrameImageUrl(), LAST_FRAME_ROLE));
        }
        return content;
    }
}
