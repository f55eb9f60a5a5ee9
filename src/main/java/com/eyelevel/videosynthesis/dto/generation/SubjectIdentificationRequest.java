package com.eyelevel.videosynthesis.dto.generation;

import jakarta.validation.constraints.NotBlank;

public record SubjectIdentificationRequest(@NotBlank String imageUrl) {
}
