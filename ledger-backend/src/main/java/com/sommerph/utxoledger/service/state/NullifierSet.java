package com.sommerph.utxoledger.service.state;

import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.ledger.Hash32;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Spent markers. Entries are never removed once a call commits.
 */
public class NullifierSet {

    private final List<Hash32> ordered = new ArrayList<>();
    private final Set<Hash32> spent = new HashSet<>();

    public static NullifierSet restore(List<Hash32> nullifiers) {
        NullifierSet set = new NullifierSet();
        for (Hash32 nullifier : nullifiers) {
            set.consume(nullifier);
        }
        return set;
    }

    /**
     * Marks {@code nullifier} spent. A nullifier seen before, including earlier in the same
     * call, fails with {@link LedgerError#NULLIFIER_ALREADY_USED}.
     */
    public void consume(Hash32 nullifier) {
        if (!spent.add(nullifier)) {
            throw new LedgerException(LedgerError.NULLIFIER_ALREADY_USED, "Nullifier already used: " + nullifier);
        }
        ordered.add(nullifier);
    }

    public boolean isUsed(Hash32 nullifier) {
        return spent.contains(nullifier);
    }

    public int size() {
        return ordered.size();
    }

    public List<Hash32> nullifiers() {
        return Collections.unmodifiableList(ordered);
    }

    int checkpoint() {
        return ordered.size();
    }

    void rollback(int size) {
        List<Hash32> added = ordered.subList(size, ordered.size());
        spent.removeAll(added);
        added.clear();
    }

}
