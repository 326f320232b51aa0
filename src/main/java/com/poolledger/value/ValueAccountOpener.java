package com.poolledger.value;

import com.poolledger.common.Address;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opens value accounts for addresses credited for the first time.
 *
 * The insert commits in its own transaction, so concurrent first credits to the same address
 * end up locking one shared row. The losing insert fails on the unique address constraint
 * and its caller simply re-reads.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ValueAccountOpener {

    private final ValueAccountRepository accountRepository;

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException if another transaction
     *         opened the account first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void open(Address address) {
        if (accountRepository.existsByAddress(address)) {
            return;
        }
        accountRepository.saveAndFlush(new ValueAccount(address));
        log.debug("Opened value account {}", address);
    }
}
