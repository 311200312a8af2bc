package com.sommerph.utxoledger.service.state;

import com.sommerph.utxoledger.model.ledger.Hash32;
import com.sommerph.utxoledger.util.HashUtils;

/**
 * Roots of empty subtrees: {@code zero[0]} is the empty leaf (32 zero bytes) and
 * {@code zero[i] = H(zero[i-1] || zero[i-1])}.
 */
public class ZeroHashTable {

    private final Hash32[] zeros;

    public ZeroHashTable(int height) {
        if (height < 1 || height > 64) {
            throw new IllegalArgumentException("Tree height must be between 1 and 64: " + height);
        }
        zeros = new Hash32[height];
        zeros[0] = Hash32.ZERO;
        for (int i = 1; i < height; i++) {
            zeros[i] = HashUtils.hashPair(zeros[i - 1], zeros[i - 1]);
        }
    }

    public int height() {
        return zeros.length;
    }

    public Hash32 get(int level) {
        return zeros[level];
    }

    /** Root of a tree with no leaves. */
    public Hash32 emptyRoot() {
        return zeros[zeros.length - 1];
    }

}
