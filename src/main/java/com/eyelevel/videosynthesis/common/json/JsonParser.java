package com.eyelevel.videosynthesis.common.json;

/**
 * Defines the contract for parsing JSON data.
 *
 * <p>Implementations hide the concrete JSON library. Response bodies from the generation services
 * differ in shape between service families, so callers usually parse into a tree type and read
 * the fields they need.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.videosynthesis.exception.json.JsonParsingException if an error occurs
     *                                                                         during JSON parsing.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @param jsonBytes The JSON data as a byte array.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     *
     * @throws com.eyelevel.videosynthesis.exception.json.JsonParsingException if an error occurs
     *                                                                         during JSON parsing.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
