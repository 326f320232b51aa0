package com.poolledger.ledger;

import com.poolledger.common.Address;
import com.poolledger.common.Amount;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Fixed-capacity ranking of a bank's largest depositors, highest first.
 *
 * The leaderboard holds identifiers only. Balances come from the supplied lookup every time
 * they are needed, so ordering is re-established on each update rather than assumed.
 *
 * Ties keep the existing order of ranked entries, and an account entering the board ranks
 * below any incumbent with an equal balance. Re-sorting and insertion both follow this rule.
 */
public class Leaderboard {

    public static final int CAPACITY = 3;

    private final Address[] slots = new Address[CAPACITY];
    private final Function<Address, Amount> balances;

    public Leaderboard(List<Address> slots, Function<Address, Amount> balances) {
        if (slots.size() != CAPACITY) {
            throw new IllegalArgumentException("Expected " + CAPACITY + " slots, got " + slots.size());
        }
        for (int i = 0; i < CAPACITY; i++) {
            this.slots[i] = slots.get(i);
        }
        this.balances = balances;
    }

    public static Leaderboard empty(Function<Address, Amount> balances) {
        return new Leaderboard(Arrays.asList(new Address[CAPACITY]), balances);
    }

    /**
     * Bring the board up to date after a deposit by {@code account}.
     */
    public void update(Address account) {
        if (account == null || account.isZero()) {
            return;
        }
        Amount balance = balances.apply(account);
        if (balance.isZero()) {
            return;
        }

        // Already ranked: its position may have changed
        if (rankOf(account) > 0) {
            resort();
            return;
        }

        for (int i = 0; i < CAPACITY; i++) {
            if (slots[i] == null) {
                slots[i] = account;
                resort();
                return;
            }
        }

        // Full: first-fit against strictly smaller balances, dropping the last entry
        for (int i = 0; i < CAPACITY; i++) {
            if (balances.apply(slots[i]).isLessThan(balance)) {
                System.arraycopy(slots, i, slots, i + 1, CAPACITY - 1 - i);
                slots[i] = account;
                return;
            }
        }
    }

    /**
     * @return 1-based rank, or 0 if the account is not on the board
     */
    public int rankOf(Address account) {
        for (int i = 0; i < CAPACITY; i++) {
            if (slots[i] != null && slots[i].equals(account)) {
                return i + 1;
            }
        }
        return 0;
    }

    /**
     * Current slots, highest first, with {@code null} for empty slots.
     */
    public List<Address> getSlots() {
        return Collections.unmodifiableList(Arrays.asList(slots.clone()));
    }

    public Amount balanceAt(int index) {
        Address account = slots[index];
        return account == null ? Amount.ZERO : balances.apply(account);
    }

    private void resort() {
        List<Address> filled = new ArrayList<>(CAPACITY);
        Map<Address, Amount> snapshot = new HashMap<>();
        for (Address slot : slots) {
            if (slot != null) {
                filled.add(slot);
                snapshot.put(slot, balances.apply(slot));
            }
        }

        // List.sort is stable, which keeps incumbents ahead on ties
        filled.sort(Comparator.comparing((Address a) -> snapshot.get(a)).reversed());

        Arrays.fill(slots, null);
        for (int i = 0; i < filled.size(); i++) {
            slots[i] = filled.get(i);
        }
    }
}
