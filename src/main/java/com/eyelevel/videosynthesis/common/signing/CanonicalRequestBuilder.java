package com.eyelevel.videosynthesis.common.signing;

import com.eyelevel.videosynthesis.exception.SigningException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Normalizes a {@link SignableRequest} into its canonical form:
 *
 * <pre>
 * METHOD
 * CANONICAL_URI
 * CANONICAL_QUERY
 * name:value\n ... (one line per header, sorted by lower-case name)
 *
 * SIGNED_HEADERS
 * PAYLOAD_HASH
 * </pre>
 *
 * Any deviation from this layout changes the signature, so the output is built by hand rather
 * than through a URI library.
 */
@Slf4j
@Component
public class CanonicalRequestBuilder {

    private static final String NEWLINE = "\n";
    private static final String DEFAULT_PATH = "/";

    /**
     * Builds the canonical request. The caller must have populated the content type, timestamp and
     * host headers beforehand: every header present is signed.
     *
     * @param request the request to canonicalize
     * @return the canonical request with its signed header list
     * @throws SigningException if the URL has no host or carries an undecodable query
     */
    public CanonicalRequest build(SignableRequest request) {
        URI uri = request.getUri();
        if (!StringUtils.hasText(uri.getHost())) {
            throw new SigningException("Cannot sign a request without a host: " + uri);
        }

        String canonicalUri = StringUtils.hasLength(uri.getRawPath()) ? uri.getRawPath() : DEFAULT_PATH;
        String canonicalQuery = canonicalQueryString(uri.getRawQuery());

        Map<String, String> sortedHeaders = new TreeMap<>();
        request.getHeaders().forEach((name, value) ->
                sortedHeaders.put(name.toLowerCase(Locale.ROOT), value == null ? "" : value.trim()));

        StringBuilder canonicalHeaders = new StringBuilder();
        sortedHeaders.forEach((name, value) -> canonicalHeaders.append(name).append(':').append(value).append(NEWLINE));
        String signedHeaders = String.join(";", sortedHeaders.keySet());

        String payloadHash = DigestUtils.sha256Hex(request.getBody());

        String value = request.getMethod().toUpperCase(Locale.ROOT) + NEWLINE
                + canonicalUri + NEWLINE
                + canonicalQuery + NEWLINE
                + canonicalHeaders + NEWLINE
                + signedHeaders + NEWLINE
                + payloadHash;
        log.trace("Canonical request built with signed headers [{}]", signedHeaders);
        return new CanonicalRequest(value, signedHeaders, payloadHash);
    }

    /**
     * Decodes every {@code key=value} pair, re-encodes key and value independently, then sorts by
     * encoded key and, for duplicate keys, by encoded value.
     */
    String canonicalQueryString(String rawQuery) {
        if (!StringUtils.hasLength(rawQuery)) {
            return "";
        }
        List<Map.Entry<String, String>> pairs = new ArrayList<>();
        for (String segment : rawQuery.split("&")) {
            if (segment.isEmpty()) {
                continue;
            }
            int separator = segment.indexOf('=');
            String key = separator < 0 ? segment : segment.substring(0, separator);
            String value = separator < 0 ? "" : segment.substring(separator + 1);
            pairs.add(Map.entry(percentEncode(decode(key)), percentEncode(decode(value))));
        }
        return pairs.stream()
                .sorted(Map.Entry.<String, String>comparingByKey().thenComparing(Map.Entry.<String, String>comparingByValue()))
                .map(pair -> pair.getKey() + "=" + pair.getValue())
                .collect(Collectors.joining("&"));
    }

    /**
     * Escapes everything except the unreserved set {@code A-Z a-z 0-9 - _ . ~}; a space becomes
     * {@code %20}.
     */
    static String percentEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new SigningException("Malformed query component: " + value, e);
        }
    }
}
