package com.eyelevel.videosynthesis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "app.synthesis" prefix: where artifacts go, how long
 * jobs are polled and how results are downloaded.
 */
@Data
@ConfigurationProperties(prefix = "app.synthesis")
public class VideoSynthesisConfig {

    private String outputDir = "output";
    private Polling polling = new Polling();
    private Download download = new Download();
    private Seedance seedance = new Seedance();

    @Data
    public static class Polling {
        private int maxAttempts = 60;
        private long delayMs = 5000;
    }

    @Data
    public static class Download {
        private int chunkSize = 8192;
        private long timeoutSeconds = 600;
    }

    @Data
    public static class Seedance {
        private String defaultModel = "doubao-seedance-1-0-pro-250528";
    }
}
