package com.webservice.customerio.util;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.vertx.core.buffer.Buffer;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import javax.annotation.Nullable;

@UtilityClass
public class JsonUtil {

    public static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /**
     * Encodes the value as UTF-8 JSON.
     *
     * @throws IllegalArgumentException if the value can't be serialized
     */
    public static Buffer encode(Object data) {
        try {
            return Buffer.buffer(MAPPER.writeValueAsBytes(data));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Decodes UTF-8 JSON straight from the bytes, so malformed UTF-8 is rejected rather than replaced.
     * Empty or blank content is not JSON and is rejected as well.
     *
     * @throws JsonProcessingException if the content is not a single JSON value
     */
    public static JsonNode decode(@Nullable Buffer body) throws JsonProcessingException {
        byte[] bytes = (body == null) ? new byte[0] : body.getBytes();
        if (isBlank(bytes)) {
            throw new EmptyContentException("No content to decode");
        }
        try {
            return MAPPER.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw e;
        } catch (IOException e) {
            throw new JsonParseException((JsonParser) null, e.getMessage(), e);
        }
    }

    private static boolean isBlank(byte[] bytes) {
        for (byte value : bytes) {
            if (value != ' ' && value != '\t' && value != '\n' && value != '\r') {
                return false;
            }
        }
        return true;
    }

    public static class EmptyContentException extends JsonProcessingException {
        public EmptyContentException(String message) {
            super(message);
        }
    }
}
