package com.eyelevel.videosynthesis.service.submission;

/**
 * A token-family image-to-video job.
 *
 * @param model            model id, or null for the configured default
 * @param prompt           free-text prompt
 * @param imageUrl         first frame
 * @param endFrameImageUrl optional last frame
 * @param resolution       {@code 480p}, {@code 720p} or {@code 1080p}
 * @param durationSeconds  clip length
 * @param cameraFixed      whether the camera stays still
 * @param seed             generation seed; negative for none
 */
public record SeedanceTaskRequest(
        String model,
        String prompt,
        String imageUrl,
        String endFrameImageUrl,
        String resolution,
        int durationSeconds,
        boolean cameraFixed,
        long seed
) {
}
