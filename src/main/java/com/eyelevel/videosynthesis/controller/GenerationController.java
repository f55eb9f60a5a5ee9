package com.eyelevel.videosynthesis.controller;

import com.eyelevel.videosynthesis.dto.common.ApiResponse;
import com.eyelevel.videosynthesis.dto.generation.GenerationJobAcceptedResponse;
import com.eyelevel.videosynthesis.dto.generation.OmniHumanVideoRequest;
import com.eyelevel.videosynthesis.dto.generation.SeedanceVideoRequest;
import com.eyelevel.videosynthesis.dto.generation.SubjectIdentificationRequest;
import com.eyelevel.videosynthesis.exception.apiclient.NotFoundException;
import com.eyelevel.videosynthesis.model.GenerationJobStatus;
import com.eyelevel.videosynthesis.service.job.GenerationJobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Provides REST endpoints for starting generation jobs and following them to completion.
 * Jobs run asynchronously; every start endpoint answers 202 with the job id to poll.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/generations")
@RequiredArgsConstructor
public class GenerationController {

    private final GenerationJobService generationJobService;

    @PostMapping("/omnihuman/subject")
    public ResponseEntity<GenerationJobAcceptedResponse> identifySubject(
            @Valid @RequestBody final SubjectIdentificationRequest request) {
        log.info("Request received to identify the subject in an image");
        final UUID jobId = generationJobService.submitSubjectIdentification(request.imageUrl());
        return ResponseEntity.accepted().body(new GenerationJobAcceptedResponse(jobId));
    }

    @PostMapping("/omnihuman/video")
    public ResponseEntity<GenerationJobAcceptedResponse> generateOmniHumanVideo(
            @Valid @RequestBody final OmniHumanVideoRequest request) {
        log.info("Request received to generate a portrait video");
        final UUID jobId = generationJobService.submitOmniHumanVideo(request.imageUrl(), request.audioUrl());
        return ResponseEntity.accepted().body(new GenerationJobAcceptedResponse(jobId));
    }

    @PostMapping("/seedance/video")
    public ResponseEntity<GenerationJobAcceptedResponse> generateSeedanceVideo(
            @Valid @RequestBody final SeedanceVideoRequest request) {
        log.info("Request received to generate an image-to-video clip at {}", request.resolution());
        final UUID jobId = generationJobService.submitSeedanceVideo(request.toTaskRequest());
        return ResponseEntity.accepted().body(new GenerationJobAcceptedResponse(jobId));
    }

    /**
     * Returns the current state of a job.
     *
     * @param jobId the id returned when the job was started.
     * @return the job status wrapped in the standard envelope.
     * @throws NotFoundException if no job with this id exists.
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<GenerationJobStatus>> getJobStatus(@PathVariable("jobId") final UUID jobId) {
        final GenerationJobStatus status = generationJobService.getJobStatus(jobId)
                .orElseThrow(() -> new NotFoundException("No generation job with id " + jobId));
        return ResponseEntity.ok(ApiResponse.success(status));
    }

    /**
     * Requests cancellation of a job. The job stops at its next poll or download chunk.
     */
    @DeleteMapping("/{jobId}")
    public ResponseEntity<Void> cancelJob(@PathVariable("jobId") final UUID jobId) {
        log.info("Request received to cancel job {}", jobId);
        if (!generationJobService.cancelJob(jobId)) {
            throw new NotFoundException("No generation job with id " + jobId);
        }
        return ResponseEntity.accepted().build();
    }
}
