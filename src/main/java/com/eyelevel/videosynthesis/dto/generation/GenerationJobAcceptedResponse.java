package com.eyelevel.videosynthesis.dto.generation;

import java.util.UUID;

public record GenerationJobAcceptedResponse(UUID jobId) {
}
