package com.usermanagement.api.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import spark.ResponseTransformer;

public abstract class JsonUtil {

    public static final ObjectMapper objectMapper = getObjectMapper();
    public static final ResponseTransformer toJson = objectMapper::writeValueAsString;

    public static ObjectMapper getObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        // Timestamps are written as ISO-8601 strings rather than epoch numbers.
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Clients may send fields that this API version does not know about.
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    public static ObjectNode objectNode () {
        return objectMapper.createObjectNode();
    }

    public static String toJsonString (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to write JSON.", e);
        }
    }

}
