package com.poolledger.api.dto;

import com.poolledger.bank.BankVariant;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for deploying a new bank.
 */
@Data
public class DeployBankRequest {

    @NotNull(message = "Variant is required")
    private BankVariant variant;
}
