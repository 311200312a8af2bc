package com.sommerph.utxoledger.service.keytype;

import com.sommerph.utxoledger.model.ledger.KeyType;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;

public class Secp256r1KeyValidator implements EphemeralKeyValidator {

    private static final ECNamedCurveParameterSpec CURVE = ECNamedCurveTable.getParameterSpec("secp256r1");

    @Override
    public KeyType keyType() {
        return KeyType.SECP256R1;
    }

    @Override
    public boolean isValid(byte[] encodedKey) {
        if (encodedKey == null || (encodedKey.length != 33 && encodedKey.length != 65)) {
            return false;
        }
        try {
            return CURVE.getCurve().decodePoint(encodedKey).isValid();
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

}
