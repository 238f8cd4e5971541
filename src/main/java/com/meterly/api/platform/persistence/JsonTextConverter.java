package com.meterly.api.platform.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import lombok.NonNull;

/**
 * <p>
 * Base {@link AttributeConverter} that stores an entity attribute as JSON in a {@code text}
 * column. Subclasses only provide the attribute type and the value to use for {@literal null}
 * columns.</p>
 *
 * <p>
 * Decoding goes through Jackson's regular object creation, so value types that validate their
 * state in a {@link com.fasterxml.jackson.annotation.JsonCreator JsonCreator} reject corrupt rows
 * instead of loading them.</p>
 *
 * @param <T> type of the entity attribute.
 */
public abstract class JsonTextConverter<T> implements AttributeConverter<T, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final TypeReference<T> type;

    protected JsonTextConverter(@NonNull TypeReference<T> type) {
        this.type = type;
    }

    /**
     * @return the attribute value for {@literal null} or blank columns.
     */
    protected abstract T emptyValue();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? emptyValue() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("failed to serialize " + type.getType().getTypeName(), e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return emptyValue();
        }

        try {
            return MAPPER.readValue(dbData, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("failed to deserialize " + type.getType().getTypeName(), e);
        }
    }
}
