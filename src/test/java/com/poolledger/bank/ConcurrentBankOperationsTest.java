package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.value.ValueTransferService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent deposits and withdrawals against the same bank must all succeed,
 * one after another, without lock-order failures.
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrentBankOperationsTest {

    private static final int ROUNDS = 40;

    @Autowired
    private BankService bankService;

    @Autowired
    private ValueTransferService valueTransferService;

    private Address authority;
    private Address alice;
    private Address bank;

    @BeforeEach
    void setUp() {
        authority = Address.random();
        alice = Address.random();
        valueTransferService.mint(alice, Amount.of(1_000_000));

        bank = bankService.deploy(authority, BankVariant.UNRESTRICTED).getAddress();
        bankService.deposit(alice, bank, Amount.of(1000));
    }

    @Test
    void testDepositsAndWithdrawalsOnOneBank() throws Exception {
        List<Throwable> failures = runConcurrently(
            () -> bankService.deposit(alice, bank, Amount.of(10)),
            () -> bankService.withdrawPooled(authority, bank, Amount.of(1)));

        assertEquals(List.of(), failures);
        assertEquals(Amount.of(1000 + ROUNDS * 10 - ROUNDS), bankService.getPooledBalance(bank));
        assertEquals(Amount.of(ROUNDS), valueTransferService.balanceOf(authority));
        assertEquals(Amount.of(1000 + ROUNDS * 10), bankService.getBalance(bank, alice));
    }

    @Test
    void testPayoutsIntoBankAuthorityAlongsideDeposits() throws Exception {
        Address receiving = bankService.deploy(authority, BankVariant.UNRESTRICTED).getAddress();
        bankService.transferAuthority(authority, bank, receiving);

        List<Throwable> failures = runConcurrently(
            () -> bankService.deposit(alice, receiving, Amount.of(5)),
            () -> bankService.withdrawPooled(receiving, bank, Amount.of(2)));

        assertEquals(List.of(), failures);
        assertEquals(Amount.of(ROUNDS * 5 + ROUNDS * 2), bankService.getPooledBalance(receiving));
        assertEquals(Amount.of(ROUNDS * 2), bankService.getBalance(receiving, bank));
        assertEquals(Amount.of(1000 - ROUNDS * 2), bankService.getPooledBalance(bank));
    }

    private List<Throwable> runConcurrently(Runnable first, Runnable second) throws InterruptedException {
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (Runnable operation : List.of(first, second)) {
                executor.submit(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < ROUNDS; i++) {
                            operation.run();
                        }
                    } catch (Throwable e) {
                        failures.add(e);
                    }
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
        }
        assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS), "Operations did not finish");
        return failures;
    }
}
