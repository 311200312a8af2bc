package com.sommerph.utxoledger.util;

import com.sommerph.utxoledger.model.ledger.Hash32;
import org.bouncycastle.crypto.digests.KeccakDigest;

public class HashUtils {

    public static byte[] keccak256(byte[] input) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(input, 0, input.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    /**
     * Hashes two tree nodes as {@code keccak256(left || right)}, the same
     * packing Solidity uses for {@code abi.encodePacked(bytes32, bytes32)}.
     */
    public static Hash32 hashPair(Hash32 left, Hash32 right) {
        KeccakDigest digest = new KeccakDigest(256);
        digest.update(left.bytes(), 0, Hash32.LENGTH);
        digest.update(right.bytes(), 0, Hash32.LENGTH);
        byte[] out = new byte[Hash32.LENGTH];
        digest.doFinal(out, 0);
        return Hash32.wrap(out);
    }

}
