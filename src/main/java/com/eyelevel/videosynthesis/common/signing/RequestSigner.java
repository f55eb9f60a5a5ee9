package com.eyelevel.videosynthesis.common.signing;

import com.eyelevel.videosynthesis.exception.SigningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Signs requests with an HMAC-SHA256 keyed-hash scheme.
 *
 * <p>Signing adds {@code Host}, {@code X-Date} and {@code Content-Type} to the request, signs
 * every header then present, and writes the result into {@code Authorization}:
 *
 * <pre>
 * HMAC-SHA256 Credential={accessKey}/{date}/{region}/{service}/request, SignedHeaders={names}, Signature={hex}
 * </pre>
 *
 * The signature is bound to the exact body bytes, so the caller must send exactly the bytes that
 * were signed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestSigner {

    public static final String ALGORITHM = "HMAC-SHA256";
    public static final String DATE_HEADER = "X-Date";

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final CanonicalRequestBuilder canonicalRequestBuilder;
    private final SigningKeyDeriver signingKeyDeriver;
    private final Clock clock;

    public Map<String, String> sign(AccessKeyCredentials credentials, SignableRequest request,
                                    String region, String service) {
        return sign(credentials, request, region, service, clock.instant());
    }

    /**
     * Signs {@code request} in place as of {@code now}.
     *
     * @return the request's headers, now including {@code Authorization}
     * @throws SigningException if the credentials are incomplete or the URL cannot be canonicalized
     */
    public Map<String, String> sign(AccessKeyCredentials credentials, SignableRequest request,
                                    String region, String service, Instant now) {
        if (credentials == null || !credentials.isComplete()) {
            throw new SigningException("Access key and secret key are required to sign a request");
        }

        String timestamp = TIMESTAMP_FORMAT.format(now);
        SigningScope scope = new SigningScope(DATE_FORMAT.format(now), region, service);

        // A stale signature would otherwise end up in the signed header set.
        request.removeHeader(HttpHeaders.AUTHORIZATION);
        request.putHeader(HttpHeaders.HOST, request.hostHeaderValue());
        request.putHeader(DATE_HEADER, timestamp);
        request.putHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

        CanonicalRequest canonicalRequest = canonicalRequestBuilder.build(request);
        String stringToSign = ALGORITHM + "\n"
                + timestamp + "\n"
                + scope.credentialScope() + "\n"
                + DigestUtils.sha256Hex(canonicalRequest.value());

        byte[] signingKey = signingKeyDeriver.deriveSigningKey(credentials.secretKey(), scope);
        String signature = new HmacUtils(HmacAlgorithms.HMAC_SHA_256, signingKey).hmacHex(stringToSign);

        String authorization = ALGORITHM
                + " Credential=" + credentials.accessKey() + "/" + scope.credentialScope()
                + ", SignedHeaders=" + canonicalRequest.signedHeaders()
                + ", Signature=" + signature;
        request.putHeader(HttpHeaders.AUTHORIZATION, authorization);

        log.debug("Signed {} {} for scope {} with headers [{}]",
                request.getMethod(), request.getUri().getRawPath(), scope.credentialScope(), canonicalRequest.signedHeaders());
        return request.getHeaders();
    }
}
