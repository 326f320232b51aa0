package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.exception.TransferFailedException;
import com.poolledger.events.ContractEventType;
import com.poolledger.events.EventLogService;
import com.poolledger.value.ValueReceiver;
import com.poolledger.value.ValueTransferService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A bank whose authority refuses incoming value cannot pay out, and the refused
 * withdrawal leaves no trace.
 */
@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:rejecting-authority;DB_CLOSE_DELAY=-1")
@ActiveProfiles("test")
class RejectingAuthorityTest {

    private static final Address COLD_WALLET = Address.of("0x00000000000000000000000000000000000000c0");

    @TestConfiguration
    static class RejectingReceiverConfig {

        @Bean
        ValueReceiver coldWalletReceiver() {
            return new ValueReceiver() {
                @Override
                public boolean accepts(Address recipient) {
                    return COLD_WALLET.equals(recipient);
                }

                @Override
                public void lockRecipient(Address recipient) {
                    // no contract row behind the wallet
                }

                @Override
                public void onValueReceived(Address recipient, Address sender, Amount amount) {
                    throw new TransferFailedException(sender, recipient, amount, "recipient does not accept value");
                }
            };
        }
    }

    @Autowired
    private BankService bankService;

    @Autowired
    private ValueTransferService valueTransferService;

    @Autowired
    private EventLogService eventLogService;

    @Test
    void testRefusedPayoutRollsBackWithdrawal() {
        Address depositor = Address.random();
        valueTransferService.mint(depositor, Amount.of(1000));
        Address bank = bankService.deploy(COLD_WALLET, BankVariant.UNRESTRICTED).getAddress();
        bankService.deposit(depositor, bank, Amount.of(400));

        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> bankService.withdrawPooled(COLD_WALLET, bank, Amount.of(100)));

        assertEquals(COLD_WALLET, e.getTo());
        assertEquals(Amount.of(400), bankService.getPooledBalance(bank));
        assertEquals(Amount.ZERO, valueTransferService.balanceOf(COLD_WALLET));
        assertTrue(eventLogService.getEvents(bank, ContractEventType.WITHDRAWN).isEmpty());
    }
}
