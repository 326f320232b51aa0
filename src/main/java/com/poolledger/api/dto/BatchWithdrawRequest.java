package com.poolledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigInteger;
import java.util.List;

/**
 * DTO for a batch delegated withdrawal. Targets and amounts are parallel lists;
 * a zero amount simply skips its target.
 */
@Data
public class BatchWithdrawRequest {

    @NotNull(message = "Targets are required")
    private List<@NotBlank String> targets;

    @NotNull(message = "Amounts are required")
    private List<@NotNull @PositiveOrZero BigInteger> amounts;
}
