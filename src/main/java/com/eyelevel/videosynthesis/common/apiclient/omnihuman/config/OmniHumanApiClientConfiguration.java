package com.eyelevel.videosynthesis.common.apiclient.omnihuman.config;

import com.eyelevel.videosynthesis.common.apiclient.authentication.Authentication;
import com.eyelevel.videosynthesis.common.apiclient.authentication.impl.HmacSignatureAuthentication;
import com.eyelevel.videosynthesis.common.signing.AccessKeyCredentials;
import com.eyelevel.videosynthesis.common.signing.RequestSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Configures the beans for the signature-protected visual API client: the {@link WebClient}, the
 * access key pair and the signing {@link Authentication}.
 */
@Slf4j
@Configuration
public class OmniHumanApiClientConfiguration {

    @Value("${app.omnihuman-client.base-url}")
    private String baseUrl;

    @Value("${app.omnihuman-client.region}")
    private String region;

    @Value("${app.omnihuman-client.service}")
    private String service;

    @Value("${app.omnihuman-client.access-key:}")
    private String accessKey;

    @Value("${app.omnihuman-client.secret-key:}")
    private String secretKey;

    @Bean("omniHumanWebClient")
    public WebClient omniHumanWebClient() {
        log.info("Initializing visual API WebClient for {}", baseUrl);
        return WebClient.builder().build();
    }

    /**
     * Loaded once at startup. Missing keys do not prevent startup; the first signed call fails
     * with a configuration error instead.
     */
    @Bean
    public AccessKeyCredentials omniHumanCredentials() {
        AccessKeyCredentials credentials = new AccessKeyCredentials(accessKey, secretKey);
        if (!credentials.isComplete()) {
            log.warn("Visual API access key or secret key is not configured. Signed calls will fail.");
        }
        return credentials;
    }

    @Bean("omniHumanAuthentication")
    public Authentication omniHumanAuthentication(RequestSigner requestSigner, AccessKeyCredentials omniHumanCredentials) {
        log.info("Initializing signature authentication for region '{}' and service '{}'", region, service);
        return new HmacSignatureAuthentication(requestSigner, omniHumanCredentials, region, service);
    }
}
