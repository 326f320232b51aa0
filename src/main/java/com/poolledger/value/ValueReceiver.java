package com.poolledger.value;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;

/**
 * Receive hook of a contract address.
 *
 * Invoked by {@link ValueTransferService} after value has been credited to a recipient it
 * {@link #accepts(Address) accepts}, inside the same transaction. Throwing from the hook
 * rejects the value and rolls back the transfer together with everything else in the
 * enclosing operation. A recipient that refuses value on principle should throw
 * {@link com.poolledger.common.exception.TransferFailedException}.
 */
public interface ValueReceiver {

    /**
     * Whether this receiver handles value sent to the given address.
     */
    boolean accepts(Address recipient);

    /**
     * Take the recipient contract's row lock. Called before any value account is locked,
     * so contract rows are always locked ahead of value accounts.
     */
    void lockRecipient(Address recipient);

    /**
     * Handle value that has just arrived.
     *
     * @param recipient the contract that received the value
     * @param sender the address the value came from
     * @param amount the amount received, possibly zero
     */
    void onValueReceived(Address recipient, Address sender, Amount amount);
}
