package com.poolledger.events;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Append-only log of contract events.
 *
 * Recording joins the caller's transaction, so an event is only ever visible
 * together with the state change it reports.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventLogService {

    private final ContractEventRepository eventRepository;

    @Transactional
    public ContractEvent record(Address contract, ContractEventType type, Address subject, Amount amount) {
        return record(contract, type, subject, null, amount);
    }

    @Transactional
    public ContractEvent recordTransfer(Address contract, ContractEventType type,
                                        Address previous, Address next) {
        return record(contract, type, previous, next, null);
    }

    private ContractEvent record(Address contract, ContractEventType type,
                                 Address subject, Address counterparty, Amount amount) {
        ContractEvent event = eventRepository.save(
            new ContractEvent(contract, type, subject, counterparty, amount));

        if (counterparty != null) {
            log.info("Event {}: contract={}, previous={}, new={}", type, contract, subject, counterparty);
        } else {
            log.info("Event {}: contract={}, party={}, amount={}", type, contract, subject, amount);
        }
        return event;
    }

    @Transactional(readOnly = true)
    public List<ContractEvent> getEvents(Address contract) {
        return eventRepository.findByContractAddressOrderBySequenceAsc(contract);
    }

    @Transactional(readOnly = true)
    public List<ContractEvent> getEvents(Address contract, ContractEventType type) {
        return eventRepository.findByContractAddressAndEventTypeOrderBySequenceAsc(contract, type);
    }
}
