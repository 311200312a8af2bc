package com.sommerph.utxoledger.model.custody;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Signed permission for the ledger to pull {@code amount} of {@code token} from a depositor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferApproval {
    private String token;
    private BigInteger amount;
    private BigInteger nonce;
    private long deadline; // epoch seconds
}
