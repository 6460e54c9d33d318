package com.traininginsight.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.traininginsight.core.loop.LearningLoopResult;
import com.traininginsight.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * JSON boundary of the engine: training sessions in, learning results out.
 *
 * <p>
 * Timestamps are ISO-8601 strings; unknown input properties are ignored.
 * Non-finite numbers (such as the infinite uncertainty of an unavailable
 * prediction) are written as the strings {@code "Infinity"},
 * {@code "-Infinity"} and {@code "NaN"}.
 * </p>
 *
 * @since 1.0.0
 */
public class LearningJsonCodec {

    private static final Logger LOG = LoggerFactory.getLogger(LearningJsonCodec.class);

    private static final TypeReference<List<Observation>> OBSERVATIONS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public LearningJsonCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Parse a JSON array of sessions.
     *
     * @throws IllegalArgumentException if the document is malformed
     */
    public List<Observation> readObservations(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return checked(mapper.readValue(json, OBSERVATIONS));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed observations JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse a JSON array of sessions from a stream. The stream is not closed.
     *
     * @throws IllegalArgumentException if the document is malformed
     * @throws IllegalStateException    if reading fails
     */
    public List<Observation> readObservations(InputStream in) {
        Objects.requireNonNull(in, "input stream must not be null");
        try {
            return checked(mapper.readValue(in, OBSERVATIONS));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed observations JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read observations", e);
        }
    }

    /**
     * Render a result as a JSON document.
     *
     * @throws IllegalStateException if serialization fails
     */
    public String writeResult(LearningLoopResult result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize learning result: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize learning result", e);
        }
    }

    private static List<Observation> checked(List<Observation> observations) {
        if (observations == null) {
            throw new IllegalArgumentException("Observations JSON must be an array, got null");
        }
        LOG.debug("Read {} observation(s)", observations.size());
        return observations;
    }
}
