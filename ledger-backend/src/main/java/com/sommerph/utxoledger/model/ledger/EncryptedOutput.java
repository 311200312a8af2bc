package com.sommerph.utxoledger.model.ledger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Encrypted note for one output commitment. Only {@code commitment}, {@code keyType},
 * the key encoding, the nonce length and the metadata size are inspected by the ledger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedOutput {

    public static final int NONCE_LENGTH = 12;

    private Hash32 commitment;
    private KeyType keyType;
    private byte[] ephemeralKey;
    private byte[] nonce;
    private byte[] ciphertext;

    // optional
    private byte[] metadata;

    public boolean hasMetadata() {
        return metadata != null && metadata.length > 0;
    }

}
