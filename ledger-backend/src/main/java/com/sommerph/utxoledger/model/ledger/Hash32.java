package com.sommerph.utxoledger.model.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.sommerph.utxoledger.util.HexUtils;

import java.util.Arrays;

/**
 * Immutable 32-byte hash. Used for commitments, nullifiers and tree nodes.
 */
public final class Hash32 implements Comparable<Hash32> {

    public static final int LENGTH = 32;

    public static final Hash32 ZERO = new Hash32(new byte[LENGTH]);

    private final byte[] value;

    private Hash32(byte[] value) {
        this.value = value;
    }

    public static Hash32 of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + LENGTH + " bytes");
        }
        return new Hash32(bytes.clone());
    }

    /** Takes ownership of {@code bytes} without copying. */
    public static Hash32 wrap(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + LENGTH + " bytes");
        }
        return new Hash32(bytes);
    }

    @JsonCreator
    public static Hash32 fromHex(String hex) {
        return of(HexUtils.fromHex(hex));
    }

    /** Returns the raw bytes. Callers must not modify the array. */
    public byte[] bytes() {
        return value;
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @JsonValue
    public String toHex() {
        return HexUtils.toHex(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Hash32)) return false;
        return Arrays.equals(value, ((Hash32) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public int compareTo(Hash32 other) {
        return Arrays.compareUnsigned(value, other.value);
    }

    @Override
    public String toString() {
        return toHex();
    }

}
