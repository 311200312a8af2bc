package com.sommerph.utxoledger.service.keytype;

import com.sommerph.utxoledger.model.ledger.KeyType;

public interface EphemeralKeyValidator {

    KeyType keyType();

    /**
     * @return true if {@code encodedKey} is a valid point encoding on this curve
     */
    boolean isValid(byte[] encodedKey);

}
