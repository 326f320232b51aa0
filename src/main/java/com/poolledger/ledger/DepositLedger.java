package com.poolledger.ledger;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Function;

/**
 * Per-account deposit records of every bank.
 *
 * Only deposits mutate a record. Callers serialize deposits into the same bank by
 * holding the bank's row lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositLedger {

    private final DepositBalanceRepository balanceRepository;

    /**
     * Add a deposit to an account's record, creating the record on first deposit.
     *
     * @return the account's new cumulative balance
     * @throws InvalidRequestException if the amount is not positive
     * @throws com.poolledger.common.exception.AmountOverflowException if the balance would overflow
     */
    @Transactional
    public Amount credit(Address bank, Address account, Amount amount) {
        if (!amount.isPositive()) {
            throw new InvalidRequestException("Deposit amount must be positive");
        }

        DepositBalance record = balanceRepository.findByBankAddressAndAccount(bank, account)
            .orElseGet(() -> new DepositBalance(bank, account));
        record.increase(amount);
        balanceRepository.save(record);

        log.debug("Deposit record of {} in bank {} is now {}", account, bank, record.getBalance());
        return record.getBalance();
    }

    @Transactional(readOnly = true)
    public Amount balanceOf(Address bank, Address account) {
        if (account == null) {
            return Amount.ZERO;
        }
        return balanceRepository.findByBankAddressAndAccount(bank, account)
            .map(DepositBalance::getBalance)
            .orElse(Amount.ZERO);
    }

    /**
     * Live balance lookup for one bank, for leaderboard maintenance and queries.
     */
    public Function<Address, Amount> balancesOf(Address bank) {
        return account -> balanceOf(bank, account);
    }
}
