package com.sommerph.utxoledger.model.event;

/**
 * Marker for notifications published after a ledger call commits.
 */
public interface LedgerEvent {
}
