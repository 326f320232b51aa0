package com.poolledger.api.controller;

import com.poolledger.bank.BankService;
import com.poolledger.bank.LeaderboardView;
import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.exception.ContractNotFoundException;
import com.poolledger.common.exception.InsufficientFundsException;
import com.poolledger.common.exception.UnauthorizedCallerException;
import com.poolledger.events.EventLogService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests: request mapping, caller identity and error translation.
 */
@WebMvcTest(BankController.class)
class BankControllerTest {

    private static final String BANK = "0x00000000000000000000000000000000000000b1";
    private static final String ALICE = "0x00000000000000000000000000000000000000a1";
    private static final String BOB = "0x00000000000000000000000000000000000000a2";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BankService bankService;

    @MockBean
    private EventLogService eventLogService;

    @Test
    void testDepositUsesCallerHeader() throws Exception {
        mockMvc.perform(post("/api/v1/banks/{bank}/deposits", BANK)
                .header(CallerHeaders.CALLER, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 250}"))
            .andExpect(status().isOk());

        verify(bankService).deposit(Address.of(ALICE), Address.of(BANK), Amount.of(250));
    }

    @Test
    void testMissingCallerIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/banks/{bank}/deposits", BANK)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 250}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.category").value("VALIDATION"));

        verifyNoInteractions(bankService);
    }

    @Test
    void testNonPositiveAmountFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/banks/{bank}/withdrawals", BANK)
                .header(CallerHeaders.CALLER, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.amount").value("Amount must be positive"));

        verifyNoInteractions(bankService);
    }

    @Test
    void testUnauthorizedWithdrawalIsForbidden() throws Exception {
        doThrow(new UnauthorizedCallerException(Address.of(ALICE), "authority", Address.of(BANK)))
            .when(bankService).withdrawPooled(any(), any(), any());

        mockMvc.perform(post("/api/v1/banks/{bank}/withdrawals", BANK)
                .header(CallerHeaders.CALLER, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 10}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.category").value("AUTHORIZATION"));
    }

    @Test
    void testOverdrawnWithdrawalIsBadRequest() throws Exception {
        doThrow(new InsufficientFundsException(Address.of(BANK), Amount.of(10), Amount.of(5)))
            .when(bankService).withdrawPooled(any(), any(), any());

        mockMvc.perform(post("/api/v1/banks/{bank}/withdrawals", BANK)
                .header(CallerHeaders.CALLER, ALICE)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 10}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.category").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    void testUnknownBankIsNotFound() throws Exception {
        when(bankService.getPooledBalance(Address.of(BANK)))
            .thenThrow(new ContractNotFoundException("Bank", Address.of(BANK)));

        mockMvc.perform(get("/api/v1/banks/{bank}/pooled-balance", BANK))
            .andExpect(status().isNotFound());
    }

    @Test
    void testLeaderboardSerializesAddressesAndAmounts() throws Exception {
        when(bankService.getLeaderboard(Address.of(BANK))).thenReturn(new LeaderboardView(
            Arrays.asList(Address.of(ALICE), Address.of(BOB), null),
            Arrays.asList(Amount.of(8), Amount.of(5), Amount.ZERO)));

        mockMvc.perform(get("/api/v1/banks/{bank}/leaderboard", BANK))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.accounts[0]").value(ALICE))
            .andExpect(jsonPath("$.accounts[1]").value(BOB))
            .andExpect(jsonPath("$.amounts[0]").value(8))
            .andExpect(jsonPath("$.amounts[2]").value(0));
    }

    @Test
    void testRankLookup() throws Exception {
        when(bankService.getRank(Address.of(BANK), Address.of(BOB))).thenReturn(2);

        mockMvc.perform(get("/api/v1/banks/{bank}/ranks/{account}", BANK, BOB))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").value(2));
    }
}
