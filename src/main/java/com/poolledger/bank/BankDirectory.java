package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.exception.ContractNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves addresses to ledger contracts.
 *
 * Banks deployed here are found by address. Ledger contracts hosted elsewhere can be
 * registered explicitly; they are resolved first and are not trusted any more than banks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BankDirectory {

    private final BankContractRepository bankRepository;
    private final BankService bankService;

    private final Map<Address, LedgerContract> external = new ConcurrentHashMap<>();

    public Optional<LedgerContract> find(Address address) {
        if (address == null) {
            return Optional.empty();
        }
        LedgerContract registered = external.get(address);
        if (registered != null) {
            return Optional.of(registered);
        }
        if (bankRepository.existsByAddress(address)) {
            return Optional.of(new BankContractHandle(address, bankService));
        }
        return Optional.empty();
    }

    public LedgerContract resolve(Address address) {
        return find(address)
            .orElseThrow(() -> new ContractNotFoundException("Ledger contract", address));
    }

    public void register(LedgerContract contract) {
        external.put(contract.getAddress(), contract);
        log.info("Registered external ledger contract {}", contract.getAddress());
    }

    public void unregister(Address address) {
        if (external.remove(address) != null) {
            log.info("Unregistered external ledger contract {}", address);
        }
    }
}
