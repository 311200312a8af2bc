package com.sommerph.utxoledger.model.ledger;

import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;

/**
 * Curve of the ephemeral key a recipient uses to decrypt an output.
 */
public enum KeyType {

    SECP256K1(0),
    SECP256R1(1);

    private final int code;

    KeyType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static KeyType fromCode(int code) {
        for (KeyType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new LedgerException(LedgerError.UNSUPPORTED_KEY_TYPE, "Unsupported key type: " + code);
    }

}
