package com.eyelevel.videosynthesis.model;

/**
 * Outcome of one submit → poll → download pipeline run.
 *
 * @param successful whether an output was produced
 * @param output     local artifact path, or the subject id for identification jobs; null on failure
 * @param message    human-readable description of the outcome
 */
public record GenerationResult(boolean successful, String output, String message) {

    public static GenerationResult success(String output, String message) {
        return new GenerationResult(true, output, message);
    }

    public static GenerationResult failure(String message) {
        return new GenerationResult(false, null, message);
    }
}
