package com.poolledger.api.controller;

import com.poolledger.agent.AgentContract;
import com.poolledger.agent.AgentService;
import com.poolledger.agent.WithdrawalOutcome;
import com.poolledger.api.dto.AdminWithdrawRequest;
import com.poolledger.api.dto.AmountRequest;
import com.poolledger.api.dto.BatchWithdrawRequest;
import com.poolledger.api.dto.RoleTransferRequest;
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
 * REST API for agent contracts.
 */
@RestController
@RequestMapping("/api/v1/agents")
@RequiredArgsConstructor
@Tag(name = "Agents", description = "Delegated withdrawals from controlled banks")
public class AgentController {

    private final AgentService agentService;
    private final EventLogService eventLogService;

    @PostMapping
    @Operation(summary = "Deploy a new agent owned by the caller")
    public ResponseEntity<AgentContract> deploy(@RequestHeader(CallerHeaders.CALLER) String caller) {
        AgentContract agent = agentService.deploy(Address.of(caller));
        return ResponseEntity.status(HttpStatus.CREATED).body(agent);
    }

    @GetMapping("/{agent}")
    @Operation(summary = "Get agent details")
    public ResponseEntity<AgentContract> getAgent(@PathVariable String agent) {
        return ResponseEntity.ok(agentService.getAgent(Address.of(agent)));
    }

    @GetMapping("/{agent}/balance")
    @Operation(summary = "Get the value held by the agent")
    public ResponseEntity<Amount> getBalance(@PathVariable String agent) {
        return ResponseEntity.ok(agentService.getBalance(Address.of(agent)));
    }

    @PostMapping("/{agent}/withdrawals")
    @Operation(summary = "Withdraw from a bank the agent is authority of")
    public ResponseEntity<Amount> adminWithdraw(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String agent,
            @Valid @RequestBody AdminWithdrawRequest request) {
        Amount received = agentService.adminWithdraw(
            Address.of(caller),
            Address.of(agent),
            Address.of(request.getTarget()),
            Amount.of(request.getAmount())
        );
        return ResponseEntity.ok(received);
    }

    @PostMapping("/{agent}/batch-withdrawals")
    @Operation(summary = "Withdraw from several banks, skipping those the agent does not control")
    public ResponseEntity<List<WithdrawalOutcome>> batchAdminWithdraw(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String agent,
            @Valid @RequestBody BatchWithdrawRequest request) {
        List<Address> targets = request.getTargets().stream().map(Address::of).toList();
        List<Amount> amounts = request.getAmounts().stream().map(Amount::of).toList();
        return ResponseEntity.ok(agentService.batchAdminWithdraw(
            Address.of(caller), Address.of(agent), targets, amounts));
    }

    @PostMapping("/{agent}/owner-withdrawals")
    @Operation(summary = "Send part of the agent's value to its owner")
    public ResponseEntity<Void> withdrawToOwner(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String agent,
            @Valid @RequestBody AmountRequest request) {
        agentService.withdrawToOwner(Address.of(caller), Address.of(agent), Amount.of(request.getAmount()));
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{agent}/emergency-withdrawal")
    @Operation(summary = "Send all of the agent's value to its owner")
    public ResponseEntity<Amount> emergencyWithdrawAll(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String agent) {
        return ResponseEntity.ok(agentService.emergencyWithdrawAll(Address.of(caller), Address.of(agent)));
    }

    @PostMapping("/{agent}/owner")
    @Operation(summary = "Hand the agent's ownership to a new address")
    public ResponseEntity<Void> transferOwnership(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @PathVariable String agent,
            @Valid @RequestBody RoleTransferRequest request) {
        agentService.transferOwnership(Address.of(caller), Address.of(agent), Address.of(request.getNewHolder()));
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{agent}/authority/{target}")
    @Operation(summary = "Check whether the agent is authority of a bank")
    public ResponseEntity<Boolean> isAuthorityOf(@PathVariable String agent, @PathVariable String target) {
        return ResponseEntity.ok(agentService.isAuthorityOf(Address.of(agent), Address.of(target)));
    }

    @GetMapping("/{agent}/withdrawable/{target}")
    @Operation(summary = "Get how much the agent could withdraw from a bank")
    public ResponseEntity<Amount> getWithdrawableBalance(@PathVariable String agent, @PathVariable String target) {
        return ResponseEntity.ok(agentService.getWithdrawableBalance(Address.of(agent), Address.of(target)));
    }

    @GetMapping("/{agent}/events")
    @Operation(summary = "Get events emitted by the agent")
    public ResponseEntity<List<ContractEvent>> getEvents(@PathVariable String agent) {
        Address address = Address.of(agent);
        agentService.getAgent(address);
        return ResponseEntity.ok(eventLogService.getEvents(address));
    }
}
