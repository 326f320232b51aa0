package com.poolledger.value;

import com.poolledger.common.Address;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for value accounts.
 */
@Repository
public interface ValueAccountRepository extends JpaRepository<ValueAccount, String> {

    Optional<ValueAccount> findByAddress(Address address);

    boolean existsByAddress(Address address);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from ValueAccount a where a.address = :address")
    Optional<ValueAccount> findByAddressForUpdate(@Param("address") Address address);
}
