package com.eyelevel.videosynthesis.common.signing;

import org.springframework.util.StringUtils;

/**
 * Access key pair used to sign requests for keyed-hash protected services. Loaded once at startup
 * and shared read-only.
 *
 * @param accessKey public key id, sent in the clear inside the Authorization header
 * @param secretKey secret used as the root of the signing key derivation
 */
public record AccessKeyCredentials(String accessKey, String secretKey) {

    public boolean isComplete() {
        return StringUtils.hasText(accessKey) && StringUtils.hasText(secretKey);
    }

    @Override
    public String toString() {
        return "AccessKeyCredentials[accessKey=" + accessKey + ", secretKey=****]";
    }
}
