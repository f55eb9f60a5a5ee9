package com.eyelevel.videosynthesis.dto.generation;

import com.eyelevel.videosynthesis.service.submission.SeedanceTaskRequest;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Image-to-video job. {@code model} falls back to the configured default, {@code seed} to none.
 */
public record SeedanceVideoRequest(
        String model,
        @NotBlank String imageUrl,
        String endFrameImageUrl,
        @NotBlank String prompt,
        @NotNull @Pattern(regexp = "480p|720p|1080p", message = "must be one of 480p, 720p, 1080p") String resolution,
        @NotNull Integer durationSeconds,
        boolean cameraFixed,
        Long seed
) {

    @JsonIgnore
    @AssertTrue(message = "durationSeconds must be 5 or 10")
    public boolean isSupportedDuration() {
        return durationSeconds == null || durationSeconds == 5 || durationSeconds == 10;
    }

    public SeedanceTaskRequest toTaskRequest() {
        return new SeedanceTaskRequest(model, prompt, imageUrl, endFrameImageUrl, resolution,
                                       durationSeconds, cameraFixed, seed == null ? -1 : seed);
    }
}
