package com.sommerph.utxoledger.model.event;

import com.sommerph.utxoledger.model.ledger.Hash32;
import com.sommerph.utxoledger.model.ledger.KeyType;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class OutputCommitted implements LedgerEvent {
    private Hash32 commitment;
    private KeyType keyType;
    private byte[] ephemeralKey;
    private byte[] nonce;
    private byte[] ciphertext;
    private long leafIndex;
}
