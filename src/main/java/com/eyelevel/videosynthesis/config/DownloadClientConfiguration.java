package com.eyelevel.videosynthesis.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the unauthenticated {@link WebClient} used to fetch result artifacts from the URLs
 * the generation services hand back.
 */
@Slf4j
@Configuration
public class DownloadClientConfiguration {

    @Bean("downloadWebClient")
    public WebClient downloadWebClient() {
        log.info("Initializing artifact download WebClient");
        return WebClient.builder().build();
    }
}
