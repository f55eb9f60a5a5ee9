package com.eyelevel.videosynthesis.common.json.jackson;

import com.eyelevel.videosynthesis.common.json.JsonParser;
import com.eyelevel.videosynthesis.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        if (json == null) {
            throw new JsonParsingException("Cannot parse a null JSON string", null);
        }
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        if (jsonBytes == null || jsonBytes.length == 0) {
            throw new JsonParsingException("Cannot parse an empty JSON body", null);
        }
        return parseJson(jsonBytes, valueType);
    }

    /**
     * Shared parsing path for both entry points.
     *
     * @throws JsonParsingException if Jackson cannot read the payload.
     */
    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}
