package com.poolledger.common;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores addresses as their normalized string form.
 */
@Converter(autoApply = true)
public class AddressConverter implements AttributeConverter<Address, String> {

    @Override
    public String convertToDatabaseColumn(Address address) {
        return address == null ? null : address.getValue();
    }

    @Override
    public Address convertToEntityAttribute(String value) {
        return value == null ? null : Address.of(value);
    }
}
