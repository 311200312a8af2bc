package com.sommerph.utxoledger.exception;

/**
 * Reason a ledger call was rejected. Every reason is fatal to the call.
 */
public enum LedgerError {

    PROOF_INVALID,
    VERIFIER_UNCONFIGURED,
    PUBLIC_VALUES_MALFORMED,
    INVALID_OLD_ROOT,
    NULLIFIER_ALREADY_USED,
    COMMITMENT_MISMATCH,
    INVALID_COMMITMENT,
    CIPHERTEXT_COUNT_MISMATCH,
    EMPTY_OUTPUTS,
    UNSUPPORTED_KEY_TYPE,
    KEY_TYPE_UNAVAILABLE,
    INVALID_EPHEMERAL_KEY,
    INVALID_NONCE,
    METADATA_TOO_LARGE,
    INSUFFICIENT_BALANCE,
    INVALID_AMOUNT,
    INVALID_RECIPIENT,
    ASSET_TRANSFER_FAILED,
    APPROVAL_INVALID,
    TREE_FULL,
    STATE_PERSISTENCE_FAILED

}
