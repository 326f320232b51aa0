package com.poolledger.common;

import com.poolledger.common.exception.ReentrantCallException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * In-progress flag per contract for the current thread.
 *
 * A contract operation that calls out to another contract may be called back before its
 * own bookkeeping is complete. Guarded operations mark their contract as busy for the
 * duration of the call and reject any nested guarded call into the same contract.
 * Operations running on other threads are ordered by row locks, not by this guard.
 */
@Component
public class ReentrancyGuard {

    private final ThreadLocal<Set<Address>> inProgress = ThreadLocal.withInitial(HashSet::new);

    public <T> T call(Address contract, Supplier<T> operation) {
        Set<Address> busy = inProgress.get();
        if (!busy.add(contract)) {
            throw new ReentrantCallException(contract);
        }
        try {
            return operation.get();
        } finally {
            busy.remove(contract);
            if (busy.isEmpty()) {
                inProgress.remove();
            }
        }
    }

    public void run(Address contract, Runnable operation) {
        call(contract, () -> {
            operation.run();
            return null;
        });
    }
}
