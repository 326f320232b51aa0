package com.poolledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for a delegated withdrawal from a single bank.
 */
@Data
public class AdminWithdrawRequest {

    @NotBlank(message = "Target is required")
    private String target;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigInteger amount;
}
