package com.poolledger.api.controller;

import com.poolledger.api.dto.MintRequest;
import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.value.ValueTransferService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the value held by any address.
 */
@RestController
@RequestMapping("/api/v1/value")
@RequiredArgsConstructor
@Tag(name = "Value", description = "Value balances and external funding")
public class ValueController {

    private final ValueTransferService valueTransferService;

    @PostMapping("/mint")
    @Operation(summary = "Credit external value to an account")
    public ResponseEntity<Amount> mint(@Valid @RequestBody MintRequest request) {
        Amount balance = valueTransferService.mint(Address.of(request.getAccount()), Amount.of(request.getAmount()));
        return ResponseEntity.ok(balance);
    }

    @GetMapping("/{address}/balance")
    @Operation(summary = "Get the value held by an address")
    public ResponseEntity<Amount> getBalance(@PathVariable String address) {
        return ResponseEntity.ok(valueTransferService.balanceOf(Address.of(address)));
    }
}
