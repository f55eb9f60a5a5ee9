package com.eyelevel.videosynthesis.common.apiclient.seedance.config;

import com.eyelevel.videosynthesis.common.apiclient.authentication.Authentication;
import com.eyelevel.videosynthesis.common.apiclient.authentication.impl.BearerTokenAuthentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the {@link WebClient} and bearer-token {@link Authentication} for the content
 * generation task API.
 */
@Slf4j
@Configuration
public class SeedanceApiClientConfiguration {

    @Value("${app.seedance-client.base-url}")
    private String baseUrl;

    @Value("${app.seedance-client.api-key:}")
    private String apiKey;

    @Bean("seedanceWebClient")
    public WebClient seedanceWebClient() {
        log.info("Initializing task API WebClient for {}", baseUrl);
        return WebClient.builder().build();
    }

    @Bean("seedanceAuthentication")
    public Authentication seedanceAuthentication() {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Task API key is not configured. API calls will fail authentication.");
        }
        return new BearerTokenAuthentication(apiKey);
    }
}
