package com.eyelevel.videosynthesis.common.apiclient.seedance;

import com.eyelevel.videosynthesis.common.apiclient.authentication.impl.BearerTokenAuthentication;
import com.eyelevel.videosynthesis.common.json.jackson.JacksonJsonParser;
import com.eyelevel.videosynthesis.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.videosynthesis.dto.seedance.request.SeedanceCreateTaskRequest;
import com.eyelevel.videosynthesis.dto.seedance.request.SeedanceCreateTaskRequest.ContentItem;
import com.eyelevel.videosynthesis.exception.ConfigurationException;
import com.eyelevel.videosynthesis.exception.apiclient.NotFoundException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeedanceApiClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void createTaskPostsWithBearerToken() {
        SeedanceApiClient client = client("ark-key", respondingWith(HttpStatus.OK, "{\"id\":\"cgt-1\"}"));

        JsonNode response = client.createTask(new SeedanceCreateTaskRequest("doubao-seedance-1-0-pro-250528",
                List.of(ContentItem.text("a cat"), ContentItem.image("https://example.com/a.png", null))));

        assertThat(response.path("id").asText()).isEqualTo("cgt-1");
        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString()).isEqualTo("https://ark.example.com/api/v3/contents/generations/tasks");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer ark-key");
        assertThat(sent.headers().getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo(MediaType.APPLICATION_JSON_VALUE);
    }

    @Test
    void fetchTaskGetsTaskById() {
        SeedanceApiClient client = client("ark-key", respondingWith(HttpStatus.OK, "{\"status\":\"running\"}"));

        JsonNode response = client.fetchTask("cgt-1");

        assertThat(response.path("status").asText()).isEqualTo("running");
        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.GET);
        assertThat(sent.url().toString()).isEqualTo("https://ark.example.com/api/v3/contents/generations/tasks/cgt-1");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer ark-key");
    }

    @Test
    void missingTokenFailsBeforeAnyRequest() {
        SeedanceApiClient client = client(null, respondingWith(HttpStatus.OK, "{}"));

        assertThatThrownBy(() -> client.fetchTask("cgt-1")).isInstanceOf(ConfigurationException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void unknownTaskIsNotFound() {
        SeedanceApiClient client = client("ark-key", respondingWith(HttpStatus.NOT_FOUND, "{\"error\":\"no such task\"}"));

        assertThatThrownBy(() -> client.fetchTask("cgt-404")).isInstanceOf(NotFoundException.class);
    }

    private SeedanceApiClient client(String token, ExchangeFunction exchange) {
        return new SeedanceApiClient(
                WebClient.builder().exchangeFunction(exchange).build(),
                new BearerTokenAuthentication(token),
                new JacksonJsonSerializer(objectMapper),
                new JacksonJsonParser(objectMapper),
                "https://ark.example.com/api/v3",
                "/contents/generations/tasks");
    }

    private ExchangeFunction respondingWith(HttpStatus status, String body) {
        return request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                                           .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                                           .body(body)
                                           .build());
        };
    }
}
