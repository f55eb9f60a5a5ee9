package com.eyelevel.videosynthesis.dto.generation;

import jakarta.validation.constraints.NotBlank;

/**
 * Portrait video job: the subject image and the audio that drives it, both publicly fetchable.
 */
public record OmniHumanVideoRequest(@NotBlank String imageUrl, @NotBlank String audioUrl) {
}
