package com.eyelevel.videosynthesis.common.signing;

import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Derives the per-day signing key through four chained HMAC-SHA256 steps:
 * secret → date → region → service → {@code "request"}. The raw secret is never used to sign
 * directly.
 */
@Component
public class SigningKeyDeriver {

    public byte[] deriveSigningKey(String secretKey, SigningScope scope) {
        byte[] dateKey = hmac(secretKey.getBytes(StandardCharsets.UTF_8), scope.date());
        byte[] regionKey = hmac(dateKey, scope.region());
        byte[] serviceKey = hmac(regionKey, scope.service());
        return hmac(serviceKey, SigningScope.TERMINATOR);
    }

    static byte[] hmac(byte[] key, String data) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, key).hmac(data);
    }
}
