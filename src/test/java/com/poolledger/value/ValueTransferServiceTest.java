package com.poolledger.value;

import com.poolledger.agent.AgentService;
import com.poolledger.bank.BankService;
import com.poolledger.bank.BankVariant;
import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.exception.InvalidRequestException;
import com.poolledger.common.exception.TransferFailedException;
import com.poolledger.events.ContractEventType;
import com.poolledger.events.EventLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class ValueTransferServiceTest {

    @Autowired
    private ValueTransferService valueTransferService;

    @Autowired
    private BankService bankService;

    @Autowired
    private AgentService agentService;

    @Autowired
    private EventLogService eventLogService;

    @Autowired
    private ValueAccountRepository accountRepository;

    private Address sender;
    private Address recipient;

    @BeforeEach
    void setUp() {
        sender = Address.random();
        recipient = Address.random();
        valueTransferService.mint(sender, Amount.of(500));
    }

    @Test
    void testTransferMovesValue() {
        valueTransferService.transfer(sender, recipient, Amount.of(120));

        assertEquals(Amount.of(380), valueTransferService.balanceOf(sender));
        assertEquals(Amount.of(120), valueTransferService.balanceOf(recipient));
    }

    @Test
    void testUnknownAddressHoldsNothing() {
        assertEquals(Amount.ZERO, valueTransferService.balanceOf(Address.random()));
    }

    @Test
    void testTransferBeyondHeldValueFails() {
        TransferFailedException e = assertThrows(TransferFailedException.class,
            () -> valueTransferService.transfer(sender, recipient, Amount.of(501)));

        assertEquals(sender, e.getFrom());
        assertEquals(Amount.of(500), valueTransferService.balanceOf(sender));
        assertEquals(Amount.ZERO, valueTransferService.balanceOf(recipient));
    }

    @Test
    void testTransferToZeroAddressFails() {
        assertThrows(TransferFailedException.class,
            () -> valueTransferService.transfer(sender, Address.ZERO, Amount.of(1)));

        assertEquals(Amount.of(500), valueTransferService.balanceOf(sender));
    }

    @Test
    void testMintRejectsInvalidRecipients() {
        Address bank = bankService.deploy(sender, BankVariant.UNRESTRICTED).getAddress();

        assertThrows(InvalidRequestException.class, () -> valueTransferService.mint(Address.ZERO, Amount.of(1)));
        assertThrows(InvalidRequestException.class, () -> valueTransferService.mint(recipient, Amount.ZERO));
        assertThrows(InvalidRequestException.class, () -> valueTransferService.mint(bank, Amount.of(1)));
        assertEquals(Amount.ZERO, valueTransferService.balanceOf(bank));
    }

    @Test
    void testTransferToContractInvokesItsReceiveHook() {
        Address agent = agentService.deploy(recipient).getAddress();

        valueTransferService.transfer(sender, agent, Amount.of(75));

        assertEquals(Amount.of(75), agentService.getBalance(agent));
        assertEquals(1, eventLogService.getEvents(agent, ContractEventType.FUNDS_RECEIVED).size());
        assertEquals(sender, eventLogService.getEvents(agent).get(0).getSubject());
    }

    @Test
    void testDeployedContractsStartWithEmptyAccounts() {
        Address bank = bankService.deploy(sender, BankVariant.UNRESTRICTED).getAddress();
        Address agent = agentService.deploy(sender).getAddress();

        assertTrue(accountRepository.existsByAddress(bank));
        assertTrue(accountRepository.existsByAddress(agent));
        assertEquals(Amount.ZERO, valueTransferService.balanceOf(bank));
    }
}
