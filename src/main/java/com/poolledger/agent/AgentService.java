package com.poolledger.agent;

import com.poolledger.bank.BankDirectory;
import com.poolledger.bank.LedgerContract;
import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.ReentrancyGuard;
import com.poolledger.common.exception.ContractNotFoundException;
import com.poolledger.common.exception.InsufficientFundsException;
import com.poolledger.common.exception.InvalidRequestException;
import com.poolledger.common.exception.ReconciliationException;
import com.poolledger.common.exception.UnauthorizedCallerException;
import com.poolledger.events.ContractEventType;
import com.poolledger.events.EventLogService;
import com.poolledger.value.ValueTransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Service for agent contracts: delegated withdrawal from banks the agent is authority of,
 * on behalf of the agent's owner.
 *
 * DELEGATED WITHDRAWAL FLOW:
 * 1. Read the target's pooled balance; reject if the request exceeds it
 * 2. Read the target's authority; reject unless it is this agent
 * 3. Record the agent's own held value
 * 4. Ask the target to withdraw
 * 5. Read the agent's held value again
 * 6. Reject unless at least the requested amount arrived
 * 7. Record what actually arrived
 *
 * Nothing the target reports is trusted beyond these checks. A target that under-delivers
 * or calls back into the agent makes the whole operation roll back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentService {

    static final String OWNER = "owner";
    static final String AUTHORITY = "authority";

    private final AgentContractRepository agentRepository;
    private final BankDirectory bankDirectory;
    private final ValueTransferService valueTransferService;
    private final EventLogService eventLog;
    private final ReentrancyGuard reentrancyGuard;

    /**
     * Deploy a new agent owned by {@code owner}.
     */
    @Transactional
    public AgentContract deploy(Address owner) {
        if (owner == null || owner.isZero()) {
            throw new InvalidRequestException("Owner cannot be the zero address");
        }
        AgentContract agent = agentRepository.save(new AgentContract(Address.random(), owner));
        valueTransferService.openAccount(agent.getAddress());
        log.info("Deployed agent {} owned by {}", agent.getAddress(), owner);
        return agent;
    }

    /**
     * Withdraw {@code amount} from a bank this agent is authority of.
     *
     * @return the value that actually arrived, never less than {@code amount}
     */
    @Transactional
    public Amount adminWithdraw(Address caller, Address agent, Address target, Amount amount) {
        return reentrancyGuard.call(agent, () -> {
            lockAgent(agent).getOwner().requireHolder(caller, OWNER, agent);

            if (!amount.isPositive()) {
                throw new InvalidRequestException("Withdrawal amount must be positive");
            }
            if (target == null || target.isZero()) {
                throw new InvalidRequestException("Target cannot be the zero address");
            }
            return withdrawFrom(agent, bankDirectory.resolve(target), amount);
        });
    }

    /**
     * Withdraw from several banks at once.
     *
     * Targets this agent does not control are skipped, as are targets with nothing to
     * withdraw. Requests larger than a target's pool are reduced to the pool. Any failure
     * while withdrawing from a selected target aborts the whole batch.
     */
    @Transactional
    public List<WithdrawalOutcome> batchAdminWithdraw(Address caller, Address agent,
                                                      List<Address> targets, List<Amount> amounts) {
        return reentrancyGuard.call(agent, () -> {
            lockAgent(agent).getOwner().requireHolder(caller, OWNER, agent);

            if (targets.size() != amounts.size()) {
                throw new InvalidRequestException(String.format(
                    "Targets and amounts differ in length: %d vs %d", targets.size(), amounts.size()));
            }

            List<WithdrawalOutcome> outcomes = new ArrayList<>(targets.size());
            for (int i = 0; i < targets.size(); i++) {
                Address target = targets.get(i);
                Amount requested = amounts.get(i);

                Optional<LedgerContract> ledger = target == null || target.isZero()
                    ? Optional.empty()
                    : bankDirectory.find(target);
                if (ledger.isEmpty() || !agent.equals(ledger.get().getAuthority())) {
                    log.debug("Batch {}: skipping {}, not controlled by agent", agent, target);
                    outcomes.add(WithdrawalOutcome.skipped(target, requested));
                    continue;
                }

                Amount clamped = requested.min(ledger.get().getPooledBalance());
                if (clamped.isZero()) {
                    log.debug("Batch {}: skipping {}, nothing to withdraw", agent, target);
                    outcomes.add(WithdrawalOutcome.skipped(target, requested));
                    continue;
                }

                Amount received = withdrawFrom(agent, ledger.get(), clamped);
                outcomes.add(WithdrawalOutcome.withdrawn(target, requested, received));
            }

            log.info("Batch withdrawal by agent {}: {} targets, {} withdrawn", agent, targets.size(),
                outcomes.stream().filter(outcome -> !outcome.isSkipped()).count());
            return outcomes;
        });
    }

    /**
     * Send part of the agent's held value to its owner.
     */
    @Transactional
    public void withdrawToOwner(Address caller, Address agent, Amount amount) {
        reentrancyGuard.run(agent, () -> {
            AgentContract contract = lockAgent(agent);
            contract.getOwner().requireHolder(caller, OWNER, agent);
            Address owner = contract.getOwner().getHolder();
            if (!amount.isPositive()) {
                throw new InvalidRequestException("Withdrawal amount must be positive");
            }
            Amount held = valueTransferService.balanceOf(agent);
            if (amount.isGreaterThan(held)) {
                throw new InsufficientFundsException(agent, amount, held);
            }

            valueTransferService.transfer(agent, owner, amount);
            log.info("Agent {} paid {} to owner {}", agent, amount, owner);
        });
    }

    /**
     * Send everything the agent holds to its owner.
     *
     * @return the amount sent
     */
    @Transactional
    public Amount emergencyWithdrawAll(Address caller, Address agent) {
        return reentrancyGuard.call(agent, () -> {
            AgentContract contract = lockAgent(agent);
            contract.getOwner().requireHolder(caller, OWNER, agent);
            Address owner = contract.getOwner().getHolder();
            Amount held = valueTransferService.balanceOf(agent);
            if (held.isZero()) {
                throw new InsufficientFundsException(agent, "nothing to withdraw");
            }

            valueTransferService.transfer(agent, owner, held);
            log.info("Agent {} emergency-withdrew {} to owner {}", agent, held, owner);
            return held;
        });
    }

    @Transactional
    public void transferOwnership(Address caller, Address agent, Address newOwner) {
        reentrancyGuard.run(agent, () -> {
            AgentContract contract = lockAgent(agent);
            Address previous = contract.getOwner().transfer(caller, newOwner, OWNER, agent);
            agentRepository.save(contract);

            eventLog.recordTransfer(agent, ContractEventType.OWNERSHIP_TRANSFERRED, previous, newOwner);
        });
    }

    /**
     * Whether the target currently reports this agent as its authority.
     * Unknown targets are not controlled.
     */
    @Transactional(readOnly = true)
    public boolean isAuthorityOf(Address agent, Address target) {
        requireAgent(agent);
        return bankDirectory.find(target)
            .map(ledger -> agent.equals(ledger.getAuthority()))
            .orElse(false);
    }

    /**
     * What the agent could withdraw from the target right now: its pool if the agent is its
     * authority, otherwise zero.
     */
    @Transactional(readOnly = true)
    public Amount getWithdrawableBalance(Address agent, Address target) {
        requireAgent(agent);
        return bankDirectory.find(target)
            .filter(ledger -> agent.equals(ledger.getAuthority()))
            .map(LedgerContract::getPooledBalance)
            .orElse(Amount.ZERO);
    }

    @Transactional(readOnly = true)
    public AgentContract getAgent(Address agent) {
        return requireAgent(agent);
    }

    @Transactional(readOnly = true)
    public Address getOwner(Address agent) {
        return requireAgent(agent).getOwner().getHolder();
    }

    /**
     * Value currently held by the agent.
     */
    @Transactional(readOnly = true)
    public Amount getBalance(Address agent) {
        requireAgent(agent);
        return valueTransferService.balanceOf(agent);
    }

    private Amount withdrawFrom(Address agent, LedgerContract target, Amount amount) {
        Address targetAddress = target.getAddress();

        Amount available = target.getPooledBalance();
        if (amount.isGreaterThan(available)) {
            throw new InsufficientFundsException(targetAddress, amount, available);
        }
        if (!agent.equals(target.getAuthority())) {
            throw new UnauthorizedCallerException(agent, AUTHORITY, targetAddress);
        }

        Amount before = valueTransferService.balanceOf(agent);
        target.withdrawPooled(agent, amount);
        Amount after = valueTransferService.balanceOf(agent);

        Amount received = after.isLessThan(before) ? Amount.ZERO : after.subtract(before);
        if (received.isLessThan(amount)) {
            throw new ReconciliationException(targetAddress, amount, received);
        }

        eventLog.record(agent, ContractEventType.FUNDS_WITHDRAWN, targetAddress, received);
        log.debug("Agent {} reconciled withdrawal from {}: requested {}, received {}",
            agent, targetAddress, amount, received);
        return received;
    }

    private AgentContract requireAgent(Address agent) {
        return agentRepository.findByAddress(agent)
            .orElseThrow(() -> new ContractNotFoundException("Agent", agent));
    }

    private AgentContract lockAgent(Address agent) {
        return agentRepository.findByAddressForUpdate(agent)
            .orElseThrow(() -> new ContractNotFoundException("Agent", agent));
    }
}
