package com.poolledger.value;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.exception.InvalidRequestException;
import com.poolledger.common.exception.TransferFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Moves value between addresses.
 *
 * This is the host layer underneath the contracts: it knows nothing about deposits,
 * leaderboards or roles. Contracts learn about incoming value through their
 * {@link ValueReceiver} hook.
 *
 * TRANSFER FLOW:
 * 1. Reject the zero address as recipient
 * 2. Lock the recipient contract's row, if the recipient is a contract
 * 3. Lock both value accounts in address order
 * 4. Verify the sender actually holds the value
 * 5. Debit the sender, credit the recipient
 * 6. Invoke the recipient's receive hook, if it has one
 *
 * Contract rows are always locked before value accounts, and value accounts in address
 * order. Any failure rolls back the whole enclosing transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValueTransferService {

    private static final int MAX_OPEN_ATTEMPTS = 5;

    private final ValueAccountRepository accountRepository;
    private final ValueAccountOpener accountOpener;
    private final List<ValueReceiver> receivers;

    @Transactional(readOnly = true)
    public Amount balanceOf(Address address) {
        return accountRepository.findByAddress(address)
            .map(ValueAccount::getBalance)
            .orElse(Amount.ZERO);
    }

    /**
     * Credit value arriving from outside the system to an external account.
     * Contracts only ever receive value through {@link #transfer}.
     */
    @Transactional
    public Amount mint(Address to, Amount amount) {
        if (to == null || to.isZero()) {
            throw new InvalidRequestException("Cannot mint to the zero address");
        }
        if (!amount.isPositive()) {
            throw new InvalidRequestException("Mint amount must be positive");
        }
        if (findReceiver(to).isPresent()) {
            throw new InvalidRequestException("Cannot mint to contract " + to + "; transfer value to it instead");
        }

        ValueAccount account = lockOrCreate(to);
        account.credit(amount);
        accountRepository.save(account);

        log.info("Minted {} to {}, balance now {}", amount, to, account.getBalance());
        return account.getBalance();
    }

    /**
     * Open an empty value account for a newly deployed contract.
     */
    @Transactional
    public void openAccount(Address address) {
        accountRepository.save(new ValueAccount(address));
    }

    @Transactional
    public void transfer(Address from, Address to, Amount amount) {
        if (to == null || to.isZero()) {
            throw new TransferFailedException(from, to, amount, "recipient is the zero address");
        }

        Optional<ValueReceiver> receiver = findReceiver(to);
        receiver.ifPresent(hook -> hook.lockRecipient(to));

        if (amount.isPositive() && to.getValue().compareTo(from.getValue()) < 0) {
            lockOrCreate(to);
        }
        Optional<ValueAccount> sender = accountRepository.findByAddressForUpdate(from);
        Amount held = sender.map(ValueAccount::getBalance).orElse(Amount.ZERO);
        if (held.isLessThan(amount)) {
            throw new TransferFailedException(from, to, amount, "sender holds only " + held);
        }

        if (amount.isPositive()) {
            ValueAccount source = sender.orElseThrow();
            source.debit(amount);
            accountRepository.save(source);

            ValueAccount recipient = lockOrCreate(to);
            recipient.credit(amount);
            accountRepository.save(recipient);
        }

        log.debug("Transferred {} from {} to {}", amount, from, to);

        receiver.ifPresent(hook -> hook.onValueReceived(to, from, amount));
    }

    private ValueAccount lockOrCreate(Address address) {
        for (int attempt = 1; ; attempt++) {
            Optional<ValueAccount> existing = accountRepository.findByAddressForUpdate(address);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                accountOpener.open(address);
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // Another transaction is opening the same account
                if (attempt >= MAX_OPEN_ATTEMPTS) {
                    throw e;
                }
                log.debug("Value account {} opened concurrently, re-reading (attempt {})", address, attempt);
            }
        }
    }

    private Optional<ValueReceiver> findReceiver(Address recipient) {
        return receivers.stream()
            .filter(receiver -> receiver.accepts(recipient))
            .findFirst();
    }
}
