package com.poolledger.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO carrying a single amount in base units: deposits and owner withdrawals.
 */
@Data
public class AmountRequest {

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigInteger amount;
}
