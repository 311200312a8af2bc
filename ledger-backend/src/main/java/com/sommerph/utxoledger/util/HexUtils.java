package com.sommerph.utxoledger.util;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

public class HexUtils {

    public static String toHex(byte[] data) {
        return "0x" + Hex.toHexString(data);
    }

    /**
     * Decodes a hex string with or without {@code 0x} prefix. An empty string or a bare
     * {@code 0x} decodes to an empty array.
     */
    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex string is null");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string has odd length: " + hex.length());
        }
        try {
            return Hex.decode(digits);
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Invalid hex string", e);
        }
    }

}
