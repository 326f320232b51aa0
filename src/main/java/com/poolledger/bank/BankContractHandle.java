package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;

/**
 * {@link LedgerContract} view of a bank deployed in this system.
 */
class BankContractHandle implements LedgerContract {

    private final Address address;
    private final BankService bankService;

    BankContractHandle(Address address, BankService bankService) {
        this.address = address;
        this.bankService = bankService;
    }

    @Override
    public Address getAddress() {
        return address;
    }

    @Override
    public Amount getPooledBalance() {
        return bankService.getPooledBalance(address);
    }

    @Override
    public Address getAuthority() {
        return bankService.getAuthority(address);
    }

    @Override
    public void withdrawPooled(Address caller, Amount amount) {
        bankService.withdrawPooled(caller, address, amount);
    }
}
