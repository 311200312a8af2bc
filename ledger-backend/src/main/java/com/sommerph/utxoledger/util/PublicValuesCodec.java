package com.sommerph.utxoledger.util;

import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.ledger.Hash32;
import com.sommerph.utxoledger.model.ledger.PublicOutputs;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * ABI codec for the public values a prover commits to:
 * {@code abi.encode((bytes32 oldRoot, bytes32[] nullifiers, bytes32[] outputCommitments))}.
 * <p>
 * Layout: word 0 is the offset of the tuple. The tuple head holds {@code oldRoot} and the
 * offsets of both arrays, relative to the start of the tuple. Each array is a length word
 * followed by its elements.
 */
public class PublicValuesCodec {

    private static final int WORD = 32;

    public static PublicOutputs decode(byte[] publicValues) {
        if (publicValues == null || publicValues.length < 6 * WORD) {
            throw malformed("public values too short: " + (publicValues == null ? 0 : publicValues.length) + " bytes");
        }
        int base = readOffset(publicValues, 0);
        requireRange(publicValues, base, 3 * WORD);

        Hash32 oldRoot = readWord(publicValues, base);
        int nullifiersAt = base + readOffset(publicValues, base + WORD);
        int commitmentsAt = base + readOffset(publicValues, base + 2 * WORD);

        List<Hash32> nullifiers = readArray(publicValues, nullifiersAt);
        List<Hash32> commitments = readArray(publicValues, commitmentsAt);
        return new PublicOutputs(oldRoot, nullifiers, commitments);
    }

    public static byte[] encode(PublicOutputs outputs) {
        List<Hash32> nullifiers = outputs.getNullifiers();
        List<Hash32> commitments = outputs.getOutputCommitments();
        int headSize = 3 * WORD;
        int nullifiersSize = WORD + nullifiers.size() * WORD;

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeUint(out, WORD);
        out.writeBytes(outputs.getOldRoot().bytes());
        writeUint(out, headSize);
        writeUint(out, headSize + nullifiersSize);
        writeArray(out, nullifiers);
        writeArray(out, commitments);
        return out.toByteArray();
    }

    private static List<Hash32> readArray(byte[] data, int position) {
        requireRange(data, position, WORD);
        int length = readOffset(data, position);
        if ((long) length * WORD > data.length) {
            throw malformed("array length " + length + " exceeds buffer");
        }
        requireRange(data, position + WORD, length * WORD);
        List<Hash32> items = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            items.add(readWord(data, position + WORD + i * WORD));
        }
        return items;
    }

    private static Hash32 readWord(byte[] data, int position) {
        return Hash32.wrap(Arrays.copyOfRange(data, position, position + WORD));
    }

    // uint256 word that must fit a non-negative int
    private static int readOffset(byte[] data, int position) {
        requireRange(data, position, WORD);
        for (int i = position; i < position + WORD - 4; i++) {
            if (data[i] != 0) {
                throw malformed("offset at " + position + " out of range");
            }
        }
        int value = ((data[position + 28] & 0xff) << 24)
                | ((data[position + 29] & 0xff) << 16)
                | ((data[position + 30] & 0xff) << 8)
                | (data[position + 31] & 0xff);
        if (value < 0) {
            throw malformed("offset at " + position + " out of range");
        }
        return value;
    }

    private static void requireRange(byte[] data, int position, int length) {
        if (position < 0 || (long) position + length > data.length) {
            throw malformed("read of " + length + " bytes at " + position + " exceeds buffer of " + data.length);
        }
    }

    private static void writeUint(ByteArrayOutputStream out, int value) {
        byte[] word = new byte[WORD];
        word[28] = (byte) (value >>> 24);
        word[29] = (byte) (value >>> 16);
        word[30] = (byte) (value >>> 8);
        word[31] = (byte) value;
        out.writeBytes(word);
    }

    private static void writeArray(ByteArrayOutputStream out, List<Hash32> items) {
        writeUint(out, items.size());
        for (Hash32 item : items) {
            out.writeBytes(item.bytes());
        }
    }

    private static LedgerException malformed(String detail) {
        return new LedgerException(LedgerError.PUBLIC_VALUES_MALFORMED, "Malformed public values: " + detail);
    }

}
