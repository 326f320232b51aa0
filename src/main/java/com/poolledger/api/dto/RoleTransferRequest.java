package com.poolledger.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for handing a bank's authority or an agent's ownership to a new address.
 */
@Data
public class RoleTransferRequest {

    @NotBlank(message = "New holder is required")
    private String newHolder;
}
