package com.poolledger.bank;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.ReentrancyGuard;
import com.poolledger.common.exception.ContractNotFoundException;
import com.poolledger.common.exception.InsufficientFundsException;
import com.poolledger.common.exception.InvalidRequestException;
import com.poolledger.events.ContractEventType;
import com.poolledger.events.EventLogService;
import com.poolledger.ledger.DepositLedger;
import com.poolledger.ledger.Leaderboard;
import com.poolledger.value.ValueTransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for bank contracts.
 *
 * DEPOSIT FLOW:
 * 1. Lock the bank's row
 * 2. Move value from the depositor to the bank's address
 * 3. The bank's receive hook ({@link BankDepositReceiver}) validates the amount against the
 *    variant's minimum, records it against the depositor and updates the leaderboard
 *
 * WITHDRAWAL FLOW:
 * 1. Check the caller is the authority
 * 2. Check the amount is positive and covered by the pool
 * 3. Record the withdrawal
 * 4. Send the value to the authority
 *
 * Every operation runs in a single transaction; a failure at any step, including inside
 * the recipient's receive hook, rolls back all of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankService {

    static final String AUTHORITY = "authority";

    private final BankContractRepository bankRepository;
    private final DepositLedger depositLedger;
    private final ValueTransferService valueTransferService;
    private final MinimumDepositPolicies depositPolicies;
    private final EventLogService eventLog;
    private final ReentrancyGuard reentrancyGuard;

    /**
     * Deploy a new bank. The deployer becomes its authority.
     */
    @Transactional
    public BankContract deploy(Address deployer, BankVariant variant) {
        if (deployer == null || deployer.isZero()) {
            throw new InvalidRequestException("Deployer cannot be the zero address");
        }
        BankContract bank = bankRepository.save(new BankContract(Address.random(), deployer, variant));
        valueTransferService.openAccount(bank.getAddress());
        log.info("Deployed {} bank {} with authority {}", variant, bank.getAddress(), deployer);
        return bank;
    }

    /**
     * Deposit value into a bank on behalf of the depositor.
     */
    @Transactional
    public void deposit(Address depositor, Address bank, Amount amount) {
        lockBank(bank);
        valueTransferService.transfer(depositor, bank, amount);
    }

    /**
     * Send pooled value to the bank's authority. Withdrawals are not attributed to
     * any depositor's record.
     */
    @Transactional
    public void withdrawPooled(Address caller, Address bank, Amount amount) {
        reentrancyGuard.run(bank, () -> {
            BankContract contract = lockBank(bank);
            contract.getAuthority().requireHolder(caller, AUTHORITY, bank);

            if (!amount.isPositive()) {
                throw new InvalidRequestException("Withdrawal amount must be positive");
            }
            Amount pooled = valueTransferService.balanceOf(bank);
            if (amount.isGreaterThan(pooled)) {
                throw new InsufficientFundsException(bank, amount, pooled);
            }

            eventLog.record(bank, ContractEventType.WITHDRAWN, caller, amount);
            valueTransferService.transfer(bank, caller, amount);

            log.info("Bank {} paid {} to authority {}", bank, amount, caller);
        });
    }

    @Transactional
    public void transferAuthority(Address caller, Address bank, Address newAuthority) {
        reentrancyGuard.run(bank, () -> {
            BankContract contract = lockBank(bank);
            Address previous = contract.getAuthority().transfer(caller, newAuthority, AUTHORITY, bank);
            bankRepository.save(contract);

            eventLog.recordTransfer(bank, ContractEventType.AUTHORITY_TRANSFERRED, previous, newAuthority);
        });
    }

    @Transactional(readOnly = true)
    public BankContract getBank(Address bank) {
        return requireBank(bank);
    }

    @Transactional(readOnly = true)
    public Amount getPooledBalance(Address bank) {
        requireBank(bank);
        return valueTransferService.balanceOf(bank);
    }

    @Transactional(readOnly = true)
    public Address getAuthority(Address bank) {
        return requireBank(bank).getAuthority().getHolder();
    }

    /**
     * Recorded cumulative deposits of an account; zero if it never deposited.
     */
    @Transactional(readOnly = true)
    public Amount getBalance(Address bank, Address account) {
        requireBank(bank);
        return depositLedger.balanceOf(bank, account);
    }

    @Transactional(readOnly = true)
    public LeaderboardView getLeaderboard(Address bank) {
        Leaderboard leaderboard = loadLeaderboard(requireBank(bank));

        List<Address> accounts = leaderboard.getSlots();
        List<Amount> amounts = new ArrayList<>(Leaderboard.CAPACITY);
        for (int i = 0; i < Leaderboard.CAPACITY; i++) {
            amounts.add(leaderboard.balanceAt(i));
        }
        return new LeaderboardView(accounts, amounts);
    }

    /**
     * @return 1-based leaderboard rank, or 0 if the account is not ranked
     */
    @Transactional(readOnly = true)
    public int getRank(Address bank, Address account) {
        return loadLeaderboard(requireBank(bank)).rankOf(account);
    }

    @Transactional(readOnly = true)
    public Amount getMinimumDeposit(Address bank) {
        return depositPolicies.policyFor(requireBank(bank).getVariant()).floor();
    }

    private Leaderboard loadLeaderboard(BankContract contract) {
        return new Leaderboard(contract.getLeaderboard().toList(),
            depositLedger.balancesOf(contract.getAddress()));
    }

    private BankContract requireBank(Address bank) {
        return bankRepository.findByAddress(bank)
            .orElseThrow(() -> new ContractNotFoundException("Bank", bank));
    }

    private BankContract lockBank(Address bank) {
        return bankRepository.findByAddressForUpdate(bank)
            .orElseThrow(() -> new ContractNotFoundException("Bank", bank));
    }
}
