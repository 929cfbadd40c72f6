package com.vidnyan.causeway.intervention;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.causeway.domain.error.InterventionParseException;
import com.vidnyan.causeway.domain.intervention.InterventionResult;
import com.vidnyan.causeway.domain.intervention.InterventionSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * JSON form of intervention specs and results, for audit and replay.
 */
@Component
@RequiredArgsConstructor
public class InterventionCodec {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public Map<String, Object> toMap(InterventionSpec spec) {
        return objectMapper.convertValue(spec, JSON_OBJECT);
    }

    public Map<String, Object> toMap(InterventionResult result) {
        return objectMapper.convertValue(result, JSON_OBJECT);
    }

    /**
     * @throws InterventionParseException if the map is not a serialized spec
     */
    public InterventionSpec specFromMap(Map<String, Object> data) {
        try {
            return objectMapper.convertValue(data, InterventionSpec.class);
        } catch (IllegalArgumentException e) {
            throw new InterventionParseException("Invalid intervention spec: " + e.getMessage(), e);
        }
    }

    /**
     * @throws InterventionParseException if the map is not a serialized result
     */
    public InterventionResult resultFromMap(Map<String, Object> data) {
        try {
            return objectMapper.convertValue(data, InterventionResult.class);
        } catch (IllegalArgumentException e) {
            throw new InterventionParseException("Invalid intervention result: " + e.getMessage(), e);
        }
    }

    public String toJson(InterventionResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize intervention result", e);
        }
    }

    /**
     * @throws InterventionParseException for malformed JSON
     */
    public InterventionResult resultFromJson(String json) {
        try {
            return objectMapper.readValue(json, InterventionResult.class);
        } catch (JsonProcessingException e) {
            throw new InterventionParseException("Invalid intervention result JSON: " + e.getOriginalMessage(), e);
        }
    }
}
