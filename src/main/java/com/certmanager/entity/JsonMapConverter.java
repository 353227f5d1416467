package com.certmanager.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.persistence.AttributeConverter;
import java.io.IOException;
import java.util.Map;

/**
 * Stores a map column as a JSON document.
 */
abstract class JsonMapConverter<V> implements AttributeConverter<Map<String, V>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TypeReference<Map<String, V>> type;

    JsonMapConverter(TypeReference<Map<String, V>> type) {
        this.type = type;
    }

    @Override
    public String convertToDatabaseColumn(Map<String, V> attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize map column", e);
        }
    }

    @Override
    public Map<String, V> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, type);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unable to read map column", e);
        }
    }
}
