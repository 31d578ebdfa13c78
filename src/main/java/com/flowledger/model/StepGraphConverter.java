package com.flowledger.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowledger.model.step.Step;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores a step graph as a JSON TEXT column.
 *
 * Hibernate instantiates converters itself, so this uses its own mapper
 * rather than the application's ObjectMapper bean.
 */
@Converter
public class StepGraphConverter implements AttributeConverter<List<Step>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Step>> STEP_LIST = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<Step> steps) {
        try {
            return MAPPER.writerFor(STEP_LIST).writeValueAsString(steps == null ? List.of() : steps);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Step graph could not be serialized", e);
        }
    }

    @Override
    public List<Step> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(json, STEP_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored step graph is not valid JSON", e);
        }
    }

    public static String toJson(List<Step> steps) {
        return new StepGraphConverter().convertToDatabaseColumn(steps);
    }

    public static List<Step> fromJson(String json) {
        return new StepGraphConverter().convertToEntityAttribute(json);
    }
}
