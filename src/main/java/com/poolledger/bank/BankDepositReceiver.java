package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.ReentrancyGuard;
import com.poolledger.common.exception.ContractNotFoundException;
import com.poolledger.common.exception.InvalidRequestException;
import com.poolledger.events.ContractEventType;
import com.poolledger.events.EventLogService;
import com.poolledger.ledger.DepositLedger;
import com.poolledger.ledger.Leaderboard;
import com.poolledger.ledger.LeaderboardSlots;
import com.poolledger.value.ValueReceiver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Receive hook of every bank: any value sent to a bank's address is a deposit.
 *
 * Rejecting here (non-positive amount, below the variant's minimum, balance overflow)
 * rolls back the transfer that delivered the value.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BankDepositReceiver implements ValueReceiver {

    private final BankContractRepository bankRepository;
    private final DepositLedger depositLedger;
    private final MinimumDepositPolicies depositPolicies;
    private final EventLogService eventLog;
    private final ReentrancyGuard reentrancyGuard;

    @Override
    public boolean accepts(Address recipient) {
        return bankRepository.existsByAddress(recipient);
    }

    @Override
    @Transactional
    public void lockRecipient(Address bank) {
        lockBank(bank);
    }

    @Override
    @Transactional
    public void onValueReceived(Address bank, Address depositor, Amount amount) {
        reentrancyGuard.run(bank, () -> {
            BankContract contract = lockBank(bank);

            if (!amount.isPositive()) {
                throw new InvalidRequestException("Deposit amount must be positive");
            }
            depositPolicies.policyFor(contract.getVariant()).check(amount);

            Amount balance = depositLedger.credit(bank, depositor, amount);

            Leaderboard leaderboard = new Leaderboard(contract.getLeaderboard().toList(),
                depositLedger.balancesOf(bank));
            leaderboard.update(depositor);
            contract.setLeaderboard(LeaderboardSlots.of(leaderboard.getSlots()));
            bankRepository.save(contract);

            eventLog.record(bank, ContractEventType.DEPOSITED, depositor, amount);

            log.info("Bank {} accepted deposit of {} from {}, recorded balance {}, rank {}",
                bank, amount, depositor, balance, leaderboard.rankOf(depositor));
        });
    }

    private BankContract lockBank(Address bank) {
        return bankRepository.findByAddressForUpdate(bank)
            .orElseThrow(() -> new ContractNotFoundException("Bank", bank));
    }
}
