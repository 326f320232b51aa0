package com.poolledger.events;

import com.poolledger.common.Address;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for contract events.
 */
@Repository
public interface ContractEventRepository extends JpaRepository<ContractEvent, Long> {

    List<ContractEvent> findByContractAddressOrderBySequenceAsc(Address contractAddress);

    List<ContractEvent> findByContractAddressAndEventTypeOrderBySequenceAsc(
        Address contractAddress, ContractEventType eventType);
}
