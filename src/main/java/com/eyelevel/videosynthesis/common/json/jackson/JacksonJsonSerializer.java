package com.eyelevel.videosynthesis.common.json.jackson;

import com.eyelevel.videosynthesis.common.json.JsonSerializer;
import com.eyelevel.videosynthesis.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    /**
     * Serializes a Java object into compact JSON. The exact output is what gets hashed when a request
     * is signed, so no pretty printing is applied.
     *
     * @throws JsonParsingException if an error occurs during JSON serialization.
     */
    @Override
    public <T> String serialize(T object) {
        log.debug("Serializing Java object to JSON string: {}", object.getClass().getName());
        try {
            String json = objectMapper.writeValueAsString(object);
            log.trace("Java object has been serialized to JSON: {}", json);
            return json;
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
