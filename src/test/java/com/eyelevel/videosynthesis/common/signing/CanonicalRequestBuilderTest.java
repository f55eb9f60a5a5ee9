package com.eyelevel.videosynthesis.common.signing;

import com.eyelevel.videosynthesis.exception.SigningException;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalRequestBuilderTest {

    private static final String BODY =
            "{\"req_key\":\"realman_avatar_picture_create_role_omni\",\"image_url\":\"https://example.com/subject.png\"}";

    private final CanonicalRequestBuilder builder = new CanonicalRequestBuilder();

    @Test
    void buildsReferenceCanonicalRequest() {
        CanonicalRequest canonical = builder.build(referenceRequest());

        assertThat(canonical.value()).isEqualTo("POST\n"
                + "/\n"
                + "Action=CVSubmitTask&Version=2022-08-31\n"
                + "content-type:application/json\n"
                + "host:visual.volcengineapi.com\n"
                + "x-date:20240501T123045Z\n"
                + "\n"
                + "content-type;host;x-date\n"
                + "e0623ca5e89d8c16e3f34b7cb88c94002b1e3b5824d4441624bdc3d62e1d952d");
        assertThat(canonical.signedHeaders()).isEqualTo("content-type;host;x-date");
    }

    @Test
    void canonicalizationIsDeterministic() {
        assertThat(builder.build(referenceRequest())).isEqualTo(builder.build(referenceRequest()));
    }

    @Test
    void queryIsSortedRegardlessOfInputOrder() {
        assertThat(builder.canonicalQueryString("b=2&a=1")).isEqualTo(builder.canonicalQueryString("a=1&b=2"));
        assertThat(builder.canonicalQueryString("b=2&a=1")).isEqualTo("a=1&b=2");
    }

    @Test
    void duplicateKeysAreOrderedByValue() {
        assertThat(builder.canonicalQueryString("k=z&k=a&j=1")).isEqualTo("j=1&k=a&k=z");
    }

    @Test
    void queryComponentsArePercentEncodedWithSpaceAsPercent20() {
        assertThat(builder.canonicalQueryString("name=a+b&path=%2Fx%2Fy&t=a~b*c"))
                .isEqualTo("name=a%20b&path=%2Fx%2Fy&t=a~b%2Ac");
    }

    @Test
    void blankValuesAreKept() {
        assertThat(builder.canonicalQueryString("empty=&flag")).isEqualTo("empty=&flag=");
    }

    @Test
    void headerNamesAreLowerCasedAndSortedCaseInsensitively() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-Date", "20240501T123045Z");
        headers.put("host", "example.com");
        headers.put("Content-Type", " application/json ");
        SignableRequest request = new SignableRequest("get", URI.create("https://example.com/tasks/1"), headers, null);

        CanonicalRequest canonical = builder.build(request);

        assertThat(canonical.value()).startsWith("GET\n/tasks/1\n\n"
                + "content-type:application/json\nhost:example.com\nx-date:20240501T123045Z\n\n");
        assertThat(canonical.payloadHash())
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void rejectsUrlWithoutHost() {
        SignableRequest request = new SignableRequest("POST", URI.create("/relative/path"), Map.of(), null);

        assertThatThrownBy(() -> builder.build(request)).isInstanceOf(SigningException.class);
    }

    static SignableRequest referenceRequest() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Host", "visual.volcengineapi.com");
        headers.put("X-Date", "20240501T123045Z");
        return new SignableRequest("POST",
                URI.create("https://visual.volcengineapi.com?Action=CVSubmitTask&Version=2022-08-31"),
                headers, BODY.getBytes(StandardCharsets.UTF_8));
    }
}
