package com.eyelevel.videosynthesis.common.signing;

import lombok.Getter;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * An outgoing HTTP request in the form the authentication layer works on. Header names are
 * matched case-insensitively; {@link #putHeader} replaces any entry differing only in case.
 *
 * <p>Authentication mutates the header map in place. Nothing else may touch it once the request
 * has been signed.
 */
@Getter
public class SignableRequest {

    private static final byte[] EMPTY_BODY = new byte[0];

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;

    public SignableRequest(String method, URI uri, Map<String, String> headers, byte[] body) {
        this.method = Objects.requireNonNull(method, "method must not be null");
        this.uri = Objects.requireNonNull(uri, "uri must not be null");
        this.headers = headers == null ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
        this.body = body == null ? EMPTY_BODY : body;
    }

    public void putHeader(String name, String value) {
        removeHeader(name);
        headers.put(name, value);
    }

    public void removeHeader(String name) {
        headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
    }

    public String getHeader(String name) {
        return headers.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    /**
     * @return host as it must appear in the Host header, including a non-default port
     */
    public String hostHeaderValue() {
        String host = uri.getHost();
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        return uri.getPort() == -1 ? host : host + ":" + uri.getPort();
    }
}
