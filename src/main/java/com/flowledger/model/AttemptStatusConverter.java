package com.flowledger.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link AttemptStatus} by its wire value ("failed"), matching the column's CHECK constraint. */
@Converter(autoApply = true)
public class AttemptStatusConverter implements AttributeConverter<AttemptStatus, String> {

    @Override
    public String convertToDatabaseColumn(AttemptStatus attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public AttemptStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : AttemptStatus.fromValue(dbData);
    }
}
