package com.poolledger.agent;

import com.poolledger.common.Address;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for deployed agents.
 */
@Repository
public interface AgentContractRepository extends JpaRepository<AgentContract, String> {

    Optional<AgentContract> findByAddress(Address address);

    boolean existsByAddress(Address address);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from AgentContract a where a.address = :address")
    Optional<AgentContract> findByAddressForUpdate(@Param("address") Address address);
}
