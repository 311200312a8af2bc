package com.sommerph.utxoledger.repository.ledger;

import com.sommerph.utxoledger.model.ledger.LedgerSnapshot;

public interface LedgerStateRegistry {

    void save(LedgerSnapshot snapshot);

    LedgerSnapshot load();

    boolean exists();

}
