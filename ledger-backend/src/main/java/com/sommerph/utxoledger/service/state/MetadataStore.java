package com.sommerph.utxoledger.service.state;

import com.sommerph.utxoledger.model.ledger.Hash32;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-commitment metadata blobs. Writes are journaled so a failed call can undo them.
 */
public class MetadataStore {

    private final Map<Hash32, byte[]> blobs = new HashMap<>();
    private final Deque<Undo> journal = new ArrayDeque<>();

    public void put(Hash32 commitment, byte[] metadata) {
        byte[] previous = blobs.put(commitment, metadata.clone());
        journal.push(new Undo(commitment, previous));
    }

    public Optional<byte[]> get(Hash32 commitment) {
        byte[] blob = blobs.get(commitment);
        return blob == null ? Optional.empty() : Optional.of(blob.clone());
    }

    public Map<Hash32, byte[]> entries() {
        Map<Hash32, byte[]> copy = new HashMap<>();
        blobs.forEach((k, v) -> copy.put(k, v.clone()));
        return copy;
    }

    int checkpoint() {
        return journal.size();
    }

    void rollback(int depth) {
        while (journal.size() > depth) {
            Undo undo = journal.pop();
            if (undo.previous == null) {
                blobs.remove(undo.commitment);
            } else {
                blobs.put(undo.commitment, undo.previous);
            }
        }
    }

    /** Drops undo records; called once a call has committed. */
    void forgetJournal() {
        journal.clear();
    }

    private static final class Undo {
        private final Hash32 commitment;
        private final byte[] previous;

        private Undo(Hash32 commitment, byte[] previous) {
            this.commitment = commitment;
            this.previous = previous;
        }
    }

}
