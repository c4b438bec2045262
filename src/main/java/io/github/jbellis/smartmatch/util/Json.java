package io.github.jbellis.smartmatch.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * JSON utility class for reading smartmatch resources.
 */
public class Json {

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
        // Utility class - no instantiation
    }

    /**
     * Creates and configures the ObjectMapper. Lexicon files are hand-edited, so comments are allowed
     * and unknown sections are ignored.
     */
    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .enable(JsonParser.Feature.ALLOW_COMMENTS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Reads a JSON document from a stream.
     */
    public static <T> T read(InputStream in, Class<T> type) throws IOException {
        return MAPPER.readValue(in, type);
    }

    /**
     * Reads a JSON document from a string.
     */
    public static <T> T read(String json, Class<T> type) throws IOException {
        return MAPPER.readValue(json, type);
    }
}
