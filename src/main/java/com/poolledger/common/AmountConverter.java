package com.poolledger.common;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.math.BigDecimal;

/**
 * Stores amounts in NUMERIC(78, 0) columns, wide enough for any 256-bit value.
 */
@Converter(autoApply = true)
public class AmountConverter implements AttributeConverter<Amount, BigDecimal> {

    @Override
    public BigDecimal convertToDatabaseColumn(Amount amount) {
        return amount == null ? null : new BigDecimal(amount.getValue());
    }

    @Override
    public Amount convertToEntityAttribute(BigDecimal value) {
        return value == null ? null : Amount.of(value.toBigIntegerExact());
    }
}
