package com.poolledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigInteger;

/**
 * DTO for crediting external value to an account.
 */
@Data
public class MintRequest {

    @NotBlank(message = "Account is required")
    private String account;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigInteger amount;
}
