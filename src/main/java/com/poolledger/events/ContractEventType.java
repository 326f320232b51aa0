package com.poolledger.events;

/**
 * Types of contract events.
 *
 * Events are appended in the same transaction as the state change they describe,
 * so a rolled-back operation never leaves an event behind.
 */
public enum ContractEventType {
    /**
     * Value received by a bank and recorded against the depositor.
     * Subject: depositor.
     */
    DEPOSITED,

    /**
     * Pooled value sent by a bank to its authority.
     * Subject: authority.
     */
    WITHDRAWN,

    /**
     * Bank authority handed over.
     * Subject: previous authority, counterparty: new authority.
     */
    AUTHORITY_TRANSFERRED,

    /**
     * Agent completed a delegated withdrawal. The amount is what actually arrived.
     * Subject: target bank.
     */
    FUNDS_WITHDRAWN,

    /**
     * Value arrived at an agent.
     * Subject: sender.
     */
    FUNDS_RECEIVED,

    /**
     * Agent ownership handed over.
     * Subject: previous owner, counterparty: new owner.
     */
    OWNERSHIP_TRANSFERRED
}
