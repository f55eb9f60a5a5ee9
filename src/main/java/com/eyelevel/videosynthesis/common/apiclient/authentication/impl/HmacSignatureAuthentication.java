package com.eyelevel.videosynthesis.common.apiclient.authentication.impl;

import com.eyelevel.videosynthesis.common.apiclient.authentication.Authentication;
import com.eyelevel.videosynthesis.common.signing.AccessKeyCredentials;
import com.eyelevel.videosynthesis.common.signing.RequestSigner;
import com.eyelevel.videosynthesis.common.signing.SignableRequest;
import com.eyelevel.videosynthesis.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;

/**
 * An implementation of {@link Authentication} that signs each request with an HMAC-SHA256
 * keyed-hash signature scoped to a region and service. A fresh timestamp is taken on every call,
 * so a request object must be signed immediately before it is sent.
 */
@Slf4j
public record HmacSignatureAuthentication(RequestSigner requestSigner, AccessKeyCredentials credentials,
                                          String region, String service) implements Authentication {

    @Override
    public void applyAuthentication(SignableRequest request) {
        if (credentials == null || !credentials.isComplete()) {
            log.error("Access key credentials are not configured; refusing to send {} {}",
                      request.getMethod(), request.getUri());
            throw new ConfigurationException("Access key credentials are not configured. Set VOLC_ACCESS_KEY and VOLC_SECRET_KEY.");
        }
        log.debug("Signing request for region '{}' and service '{}'", region, service);
        requestSigner.sign(credentials, request, region, service);
    }
}
