package com.sommerph.utxoledger.service.custody;

import com.sommerph.utxoledger.model.custody.TransferApproval;

import java.math.BigInteger;

/**
 * Custodian of the asset backing the ledger. Failed transfers throw
 * {@link AssetTransferException} and move nothing.
 */
public interface AssetCustody {

    void pull(String from, BigInteger amount);

    void pullWithApproval(TransferApproval approval, byte[] signature, String depositor, BigInteger amount);

    void release(String to, BigInteger amount);

    /** Amount currently held on behalf of the ledger. */
    BigInteger custodiedBalance();

}
