package com.websubrelay.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class SubscriptionStatusConverter implements AttributeConverter<SubscriptionStatus, String> {

    @Override
    public String convertToDatabaseColumn(SubscriptionStatus status) {
        return status == null ? null : status.value();
    }

    @Override
    public SubscriptionStatus convertToEntityAttribute(String value) {
        return value == null ? null : SubscriptionStatus.fromValue(value);
    }
}
