package com.sommerph.utxoledger.repository.ledger;

import com.sommerph.utxoledger.model.ledger.LedgerSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public class InMemoryLedgerStateRegistry implements LedgerStateRegistry {

    private final AtomicReference<LedgerSnapshot> store = new AtomicReference<>();

    @Override
    public void save(LedgerSnapshot snapshot) {
        log.debug("Save ledger state with {} leaves", snapshot.getLeaves().size());
        store.set(snapshot);
    }

    @Override
    public LedgerSnapshot load() {
        LedgerSnapshot snapshot = store.get();
        if (snapshot == null) {
            throw new IllegalStateException("No ledger state saved");
        }
        return snapshot;
    }

    @Override
    public boolean exists() {
        return store.get() != null;
    }

}
