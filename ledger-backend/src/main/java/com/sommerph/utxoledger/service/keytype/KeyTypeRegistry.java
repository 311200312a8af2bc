package com.sommerph.utxoledger.service.keytype;

import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.ledger.KeyType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Capability table of supported ephemeral key types. A type without a validator is
 * known but unavailable on this deployment.
 */
public class KeyTypeRegistry {

    private final Map<KeyType, EphemeralKeyValidator> validators = new EnumMap<>(KeyType.class);

    public KeyTypeRegistry(List<EphemeralKeyValidator> validators) {
        validators.forEach(v -> this.validators.put(v.keyType(), v));
    }

    public boolean isAvailable(KeyType keyType) {
        return keyType != null && validators.containsKey(keyType);
    }

    public void validate(KeyType keyType, byte[] ephemeralKey) {
        if (keyType == null) {
            throw new LedgerException(LedgerError.UNSUPPORTED_KEY_TYPE, "Key type is missing");
        }
        EphemeralKeyValidator validator = validators.get(keyType);
        if (validator == null) {
            throw new LedgerException(LedgerError.KEY_TYPE_UNAVAILABLE, "Key type not enabled: " + keyType);
        }
        if (!validator.isValid(ephemeralKey)) {
            throw new LedgerException(LedgerError.INVALID_EPHEMERAL_KEY, "Invalid " + keyType + " ephemeral key");
        }
    }

}
