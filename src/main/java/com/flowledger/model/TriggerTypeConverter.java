package com.flowledger.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores {@link TriggerType} by its wire value ("runtime_record_created"), matching the column's CHECK constraint. */
@Converter(autoApply = true)
public class TriggerTypeConverter implements AttributeConverter<TriggerType, String> {

    @Override
    public String convertToDatabaseColumn(TriggerType attribute) {
        return attribute == null ? null : attribute.value();
    }

    @Override
    public TriggerType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TriggerType.fromValue(dbData);
    }
}
