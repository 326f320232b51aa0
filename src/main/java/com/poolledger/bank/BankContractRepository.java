package com.poolledger.bank;

import com.poolledger.common.Address;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for deployed banks.
 */
@Repository
public interface BankContractRepository extends JpaRepository<BankContract, String> {

    Optional<BankContract> findByAddress(Address address);

    boolean existsByAddress(Address address);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from BankContract b where b.address = :address")
    Optional<BankContract> findByAddressForUpdate(@Param("address") Address address);
}
