package com.eyelevel.videosynthesis;

import com.eyelevel.videosynthesis.config.VideoSynthesisConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

/**
 * The main entry point for the Video Synthesis Spring Boot application.
 * <p>
 * {@link EnableConfigurationProperties} binds the properties prefixed with "app.synthesis" to
 * {@link VideoSynthesisConfig}.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = VideoSynthesisConfig.class)
public class VideoSynthesisApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting VideoSynthesisApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(VideoSynthesisApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "VideoSynthesis"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Output dir: {}", env.getProperty("app.synthesis.output-dir", "output"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
