package com.poolledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Pool Ledger.
 *
 * Pool Ledger is a custodial pooled balance ledger. Depositors credit a shared pool held
 * by a bank contract, which records each depositor's contribution and ranks its top three
 * depositors. Pooled value can only leave through the bank's authority, which may itself be
 * an agent contract gated by its own owner.
 */
@SpringBootApplication
public class PoolLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoolLedgerApplication.class, args);
    }
}
