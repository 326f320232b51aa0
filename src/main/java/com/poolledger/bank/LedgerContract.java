package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;

/**
 * What an agent can see and do on a ledger contract it may control.
 *
 * TRUST BOUNDARY:
 * Callers must not trust anything an implementation reports. The pooled balance and the
 * authority may be stale or false, and {@link #withdrawPooled} may return normally while
 * delivering less than requested. Agents therefore re-read the authority before every
 * withdrawal and reconcile the value that actually arrived.
 *
 * Deployed banks are reached through {@link BankContractHandle}; externally hosted
 * implementations can be registered with {@link BankDirectory}.
 */
public interface LedgerContract {

    Address getAddress();

    /**
     * Total value the contract reports as available for withdrawal.
     */
    Amount getPooledBalance();

    /**
     * Current authority as reported by the contract.
     */
    Address getAuthority();

    /**
     * Send {@code amount} of pooled value to the caller, who must be the authority.
     *
     * @throws com.poolledger.common.exception.UnauthorizedCallerException if the caller is not the authority
     * @throws com.poolledger.common.exception.InsufficientFundsException if the pool holds less
     * @throws com.poolledger.common.exception.TransferFailedException if sending the value fails
     */
    void withdrawPooled(Address caller, Amount amount);
}
