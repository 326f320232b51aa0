package com.poolledger.ledger;

import com.poolledger.common.Address;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for per-account deposit records.
 */
@Repository
public interface DepositBalanceRepository extends JpaRepository<DepositBalance, String> {

    Optional<DepositBalance> findByBankAddressAndAccount(Address bankAddress, Address account);
}
