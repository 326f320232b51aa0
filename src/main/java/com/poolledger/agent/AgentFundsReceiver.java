package com.poolledger.agent;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;
import com.poolledger.common.exception.ContractNotFoundException;
import com.poolledger.events.ContractEventType;
import com.poolledger.events.EventLogService;
import com.poolledger.value.ValueReceiver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Receive hook of every agent. Agents accept value from anyone, including
 * in the middle of their own delegated withdrawals.
 */
@Component
@RequiredArgsConstructor
public class AgentFundsReceiver implements ValueReceiver {

    private final AgentContractRepository agentRepository;
    private final EventLogService eventLog;

    @Override
    public boolean accepts(Address recipient) {
        return agentRepository.existsByAddress(recipient);
    }

    @Override
    @Transactional
    public void lockRecipient(Address agent) {
        agentRepository.findByAddressForUpdate(agent)
            .orElseThrow(() -> new ContractNotFoundException("Agent", agent));
    }

    @Override
    @Transactional
    public void onValueReceived(Address agent, Address sender, Amount amount) {
        eventLog.record(agent, ContractEventType.FUNDS_RECEIVED, sender, amount);
    }
}
