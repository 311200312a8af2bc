package com.sommerph.utxoledger.service.state;

import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.ledger.Hash32;
import com.sommerph.utxoledger.model.ledger.MerkleProof;
import com.sommerph.utxoledger.util.HashUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-height, append-only Merkle tree over commitments.
 * <p>
 * Only the rightmost filled node of every level is kept ({@code filledSubtrees}), which is
 * enough to recompute the root after an append in {@code height} hashes. The root matches
 * a fully materialized tree of {@code 2^height} leaves where every unfilled leaf is
 * {@code zero[0]}.
 */
public class IncrementalMerkleTree {

    private final ZeroHashTable zeros;
    private final List<Hash32> leaves;
    private final Hash32[] filledSubtrees;
    private final long capacity;
    private Hash32 root;

    public IncrementalMerkleTree(ZeroHashTable zeros) {
        this.zeros = zeros;
        this.leaves = new ArrayList<>();
        this.filledSubtrees = new Hash32[zeros.height()];
        for (int level = 0; level < filledSubtrees.length; level++) {
            filledSubtrees[level] = zeros.get(level);
        }
        this.capacity = zeros.height() >= 31 ? Integer.MAX_VALUE : 1L << zeros.height();
        this.root = zeros.emptyRoot();
    }

    /**
     * Rebuilds a tree by replaying {@code leaves}. Fails if the replayed root does not
     * match {@code expectedRoot}.
     */
    public static IncrementalMerkleTree replay(ZeroHashTable zeros, List<Hash32> leaves, Hash32 expectedRoot) {
        IncrementalMerkleTree tree = new IncrementalMerkleTree(zeros);
        for (Hash32 leaf : leaves) {
            tree.insert(leaf);
        }
        if (expectedRoot != null && !tree.root.equals(expectedRoot)) {
            throw new IllegalStateException("Replayed root " + tree.root + " does not match stored root " + expectedRoot);
        }
        return tree;
    }

    /**
     * Appends a leaf and returns its index.
     */
    public long insert(Hash32 leaf) {
        if (leaves.size() >= capacity) {
            throw new LedgerException(LedgerError.TREE_FULL, "Merkle tree is full at " + leaves.size() + " leaves");
        }
        long index = leaves.size();
        leaves.add(leaf);

        Hash32 current = leaf;
        long idx = index;
        for (int level = 0; level < filledSubtrees.length; level++) {
            if (idx % 2 == 0) {
                filledSubtrees[level] = current;
                current = HashUtils.hashPair(current, zeros.get(level));
            } else {
                current = HashUtils.hashPair(filledSubtrees[level], current);
            }
            idx /= 2;
        }
        root = current;
        return index;
    }

    public Hash32 root() {
        return root;
    }

    public long nextIndex() {
        return leaves.size();
    }

    public int height() {
        return filledSubtrees.length;
    }

    public Optional<Hash32> leaf(long index) {
        if (index < 0 || index >= leaves.size()) {
            return Optional.empty();
        }
        return Optional.of(leaves.get((int) index));
    }

    public List<Hash32> leaves(long from, int count) {
        if (from < 0 || count < 0) {
            throw new IllegalArgumentException("from and count must be non-negative");
        }
        if (from >= leaves.size()) {
            return Collections.emptyList();
        }
        int end = (int) Math.min(leaves.size(), from + count);
        return List.copyOf(leaves.subList((int) from, end));
    }

    public List<Hash32> allLeaves() {
        return Collections.unmodifiableList(leaves);
    }

    public List<Hash32> filledSubtrees() {
        return List.of(filledSubtrees);
    }

    /**
     * Builds the sibling path of a leaf by recomputing every level from the recorded leaves.
     * Siblings beyond the filled part of a level are the zero hash of that level.
     */
    public Optional<MerkleProof> prove(long leafIndex) {
        if (leafIndex < 0 || leafIndex >= leaves.size()) {
            return Optional.empty();
        }
        List<Hash32> siblings = new ArrayList<>(filledSubtrees.length);
        List<Hash32> levelNodes = new ArrayList<>(leaves);
        int index = (int) leafIndex;

        for (int level = 0; level < filledSubtrees.length; level++) {
            int siblingIndex = index % 2 == 0 ? index + 1 : index - 1;
            siblings.add(siblingIndex < levelNodes.size() ? levelNodes.get(siblingIndex) : zeros.get(level));

            List<Hash32> next = new ArrayList<>((levelNodes.size() + 1) / 2);
            for (int i = 0; i < levelNodes.size(); i += 2) {
                Hash32 right = i + 1 < levelNodes.size() ? levelNodes.get(i + 1) : zeros.get(level);
                next.add(HashUtils.hashPair(levelNodes.get(i), right));
            }
            levelNodes = next;
            index /= 2;
        }
        return Optional.of(new MerkleProof(leafIndex, siblings));
    }

    public static boolean verifyProof(Hash32 leaf, MerkleProof proof, Hash32 expectedRoot) {
        Hash32 current = leaf;
        long index = proof.getLeafIndex();
        for (Hash32 sibling : proof.getSiblings()) {
            current = index % 2 == 0 ? HashUtils.hashPair(current, sibling) : HashUtils.hashPair(sibling, current);
            index /= 2;
        }
        return current.equals(expectedRoot);
    }

    Checkpoint checkpoint() {
        return new Checkpoint(leaves.size(), filledSubtrees.clone(), root);
    }

    void rollback(Checkpoint checkpoint) {
        leaves.subList(checkpoint.size, leaves.size()).clear();
        System.arraycopy(checkpoint.filledSubtrees, 0, filledSubtrees, 0, filledSubtrees.length);
        root = checkpoint.root;
    }

    static final class Checkpoint {
        private final int size;
        private final Hash32[] filledSubtrees;
        private final Hash32 root;

        private Checkpoint(int size, Hash32[] filledSubtrees, Hash32 root) {
            this.size = size;
            this.filledSubtrees = filledSubtrees;
            this.root = root;
        }
    }

}
