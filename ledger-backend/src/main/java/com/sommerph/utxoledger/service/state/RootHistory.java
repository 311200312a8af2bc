package com.sommerph.utxoledger.service.state;

import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.ledger.Hash32;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Every root the tree has ever had. A proof may be anchored to any of them; spending
 * safety comes from the {@link NullifierSet}, not from root freshness.
 */
public class RootHistory {

    private final List<Hash32> ordered = new ArrayList<>();
    private final Set<Hash32> members = new HashSet<>();

    public RootHistory(Hash32 genesisRoot) {
        add(genesisRoot);
    }

    public static RootHistory restore(List<Hash32> roots) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("Root history must contain the genesis root");
        }
        RootHistory history = new RootHistory(roots.get(0));
        for (int i = 1; i < roots.size(); i++) {
            history.add(roots.get(i));
        }
        return history;
    }

    public boolean add(Hash32 root) {
        if (!members.add(root)) {
            return false;
        }
        ordered.add(root);
        return true;
    }

    public boolean contains(Hash32 root) {
        return members.contains(root);
    }

    public void admit(Hash32 oldRoot) {
        if (oldRoot == null || !members.contains(oldRoot)) {
            throw new LedgerException(LedgerError.INVALID_OLD_ROOT, "Unknown root: " + oldRoot);
        }
    }

    public int size() {
        return ordered.size();
    }

    public List<Hash32> roots() {
        return Collections.unmodifiableList(ordered);
    }

    int checkpoint() {
        return ordered.size();
    }

    void rollback(int size) {
        List<Hash32> added = ordered.subList(size, ordered.size());
        members.removeAll(added);
        added.clear();
    }

}
