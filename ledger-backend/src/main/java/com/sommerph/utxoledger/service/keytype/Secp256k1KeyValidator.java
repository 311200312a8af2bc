package com.sommerph.utxoledger.service.keytype;

import com.sommerph.utxoledger.model.ledger.KeyType;
import org.bitcoinj.core.ECKey;

public class Secp256k1KeyValidator implements EphemeralKeyValidator {

    @Override
    public KeyType keyType() {
        return KeyType.SECP256K1;
    }

    @Override
    public boolean isValid(byte[] encodedKey) {
        if (encodedKey == null || (encodedKey.length != 33 && encodedKey.length != 65)) {
            return false;
        }
        try {
            ECKey.fromPublicOnly(encodedKey);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

}
