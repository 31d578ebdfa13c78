package com.flowledger.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link RunStatus} by its wire value ("dead_lettered"), matching the column's CHECK constraint. */
@Converter(autoApply = true)
public class RunStatusConverter implements AttributeConverter<RunStatus, String> {

    @Override
    public String convertToDatabaseColumn(RunStatus attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public RunStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : RunStatus.fromValue(dbData);
    }
}
