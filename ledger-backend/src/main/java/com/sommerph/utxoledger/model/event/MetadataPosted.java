package com.sommerph.utxoledger.model.event;

import com.sommerph.utxoledger.model.ledger.Hash32;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class MetadataPosted implements LedgerEvent {
    private Hash32 commitment;
    private int size;
}
