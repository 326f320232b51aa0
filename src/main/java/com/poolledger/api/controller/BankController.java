package com.poolledger.api.controller;

import com.poolledger.api.dto.AmountRequest;
import com.poolledger.api.dto.DeployBankRequest;
import com.poolledger.api.dto.RoleTransferRequest;
import com.poolledger.bank.BankContract;
import com.poolledger.bank.BankService;
import com.poolledger.bank.LeaderboardView;
import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.events.ContractEvent;
import com.poolledger.events.EventLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for bank contracts.
 */
@RestController
@RequestMapping("/api/v1/banks")
@RequiredArgsConstructor
@Tag(name = "Banks", description = "Pooled deposits, authority withdrawals and leaderboard")
public class BankController {

    private final BankService bankService;
    private final EventLogService eventLogService;

    @PostMapping
    @Operation(summary = "Deploy a new bank with the caller as authority")
    public ResponseEntity<BankContract> deploy(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @Valid @RequestBody DeployBankRequest request) {
        BankContract bank = bankService.deploy(Address.of(caller), request.getVariant());
        return ResponseEntity.status(HttpStatus.CREATED).body(bank);
    }

    @GetMapping("/{bank}")
    @Operation(summary = "Get bank details")
    public ResponseEntity<BankContract> getBank(@PathVariable String bank) {
        return ResponseEntity.ok(bankService.getBank(Address.of(bank)));
    }

    @PostMapping("/{bank}/deposits")
    @Operation(summary = "Deposit the caller's value into the bank")
    public ResponseEntity<Void> deposit(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String bank,
            @Valid @RequestBody AmountRequest request) {
        bankService.deposit(Address.of(caller), Address.of(bank), Amount.of(request.getAmount()));
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{bank}/withdrawals")
    @Operation(summary = "Withdraw pooled value to the authority")
    public ResponseEntity<Void> withdraw(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String bank,
            @Valid @RequestBody AmountRequest request) {
        bankService.withdrawPooled(Address.of(caller), Address.of(bank), Amount.of(request.getAmount()));
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{bank}/authority")
    @Operation(summary = "Hand the bank's authority to a new address")
    public ResponseEntity<Void> transferAuthority(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String bank,
            @Valid @RequestBody RoleTransferRequest request) {
        bankService.transferAuthority(Address.of(caller), Address.of(bank), Address.of(request.getNewHolder()));
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{bank}/pooled-balance")
    @Operation(summary = "Get the total value held by the bank")
    public ResponseEntity<Amount> getPooledBalance(@PathVariable String bank) {
        return ResponseEntity.ok(bankService.getPooledBalance(Address.of(bank)));
    }

    @GetMapping("/{bank}/leaderboard")
    @Operation(summary = "Get the top three depositors and their balances")
    public ResponseEntity<LeaderboardView> getLeaderboard(@PathVariable String bank) {
        return ResponseEntity.ok(bankService.getLeaderboard(Address.of(bank)));
    }

    @GetMapping("/{bank}/ranks/{account}")
    @Operation(summary = "Get an account's leaderboard rank (1-3, or 0 if unranked)")
    public ResponseEntity<Integer> getRank(@PathVariable String bank, @PathVariable String account) {
        return ResponseEntity.ok(bankService.getRank(Address.of(bank), Address.of(account)));
    }

    @GetMapping("/{bank}/minimum-deposit")
    @Operation(summary = "Get the smallest deposit the bank accepts")
    public ResponseEntity<Amount> getMinimumDeposit(@PathVariable String bank) {
        return ResponseEntity.ok(bankService.getMinimumDeposit(Address.of(bank)));
    }

    @GetMapping("/{bank}/balances/{account}")
    @Operation(summary = "Get an account's recorded cumulative deposits")
    public ResponseEntity<Amount> getBalance(@PathVariable String bank, @PathVariable String account) {
        return ResponseEntity.ok(bankService.getBalance(Address.of(bank), Address.of(account)));
    }

    @GetMapping("/{bank}/events")
    @Operation(summary = "Get events emitted by the bank")
    public ResponseEntity<List<ContractEvent>> getEvents(@PathVariable String bank) {
        Address address = Address.of(bank);
        bankService.getBank(address);
        return ResponseEntity.ok(eventLogService.getEvents(address));
    }
}
