package com.sommerph.utxoledger.service.state;

import com.sommerph.utxoledger.model.ledger.Hash32;
import com.sommerph.utxoledger.model.ledger.LedgerSnapshot;
import com.sommerph.utxoledger.util.HexUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The shared mutable ledger: tree, root history, nullifiers, metadata and the deposited
 * total. Owned by exactly one {@link com.sommerph.utxoledger.service.ledger.LedgerStateMachine}.
 * <p>
 * A call takes a {@link Checkpoint} first and either {@link #commit}s or {@link #rollback}s to it,
 * so no partial effect of a failed call remains.
 * Checkpoints do not nest.
 */
public class LedgerState {

    private final ZeroHashTable zeros;
    private final IncrementalMerkleTree tree;
    private final RootHistory rootHistory;
    private final NullifierSet nullifiers;
    private final MetadataStore metadata;
    private BigInteger totalDeposited;

    private LedgerState(ZeroHashTable zeros, IncrementalMerkleTree tree, RootHistory rootHistory,
                        NullifierSet nullifiers, MetadataStore metadata, BigInteger totalDeposited) {
        this.zeros = zeros;
        this.tree = tree;
        this.rootHistory = rootHistory;
        this.nullifiers = nullifiers;
        this.metadata = metadata;
        this.totalDeposited = totalDeposited;
    }

    public static LedgerState genesis(int treeHeight) {
        ZeroHashTable zeros = new ZeroHashTable(treeHeight);
        IncrementalMerkleTree tree = new IncrementalMerkleTree(zeros);
        return new LedgerState(zeros, tree, new RootHistory(tree.root()), new NullifierSet(),
                new MetadataStore(), BigInteger.ZERO);
    }

    public static LedgerState fromSnapshot(LedgerSnapshot snapshot) {
        ZeroHashTable zeros = new ZeroHashTable(snapshot.getTreeHeight());
        IncrementalMerkleTree tree = IncrementalMerkleTree.replay(zeros, snapshot.getLeaves(), snapshot.getRoot());
        if (!snapshot.getFilledSubtrees().isEmpty() && !tree.filledSubtrees().equals(snapshot.getFilledSubtrees())) {
            throw new IllegalStateException("Stored filled subtrees do not match replayed leaves");
        }
        RootHistory rootHistory = RootHistory.restore(snapshot.getRootHistory());
        if (!rootHistory.contains(zeros.emptyRoot()) || !rootHistory.contains(tree.root())) {
            throw new IllegalStateException("Root history is missing the empty root or the current root");
        }
        MetadataStore metadata = new MetadataStore();
        snapshot.getMetadata().forEach((commitment, blob) ->
                metadata.put(Hash32.fromHex(commitment), HexUtils.fromHex(blob)));
        metadata.forgetJournal();
        return new LedgerState(zeros, tree, rootHistory, NullifierSet.restore(snapshot.getNullifiers()),
                metadata, snapshot.getTotalDeposited());
    }

    public LedgerSnapshot toSnapshot() {
        Map<String, String> blobs = new LinkedHashMap<>();
        metadata.entries().forEach((commitment, blob) -> blobs.put(commitment.toHex(), HexUtils.toHex(blob)));
        return new LedgerSnapshot(
                tree.height(),
                new ArrayList<>(tree.allLeaves()),
                new ArrayList<>(tree.filledSubtrees()),
                tree.root(),
                new ArrayList<>(rootHistory.roots()),
                new ArrayList<>(nullifiers.nullifiers()),
                blobs,
                totalDeposited
        );
    }

    /**
     * Appends a commitment and records the resulting root in the history.
     */
    public long insertCommitment(Hash32 commitment) {
        long index = tree.insert(commitment);
        rootHistory.add(tree.root());
        return index;
    }

    public void credit(BigInteger amount) {
        totalDeposited = totalDeposited.add(amount);
    }

    public void debit(BigInteger amount) {
        if (amount.compareTo(totalDeposited) > 0) {
            throw new IllegalStateException("Debit exceeds total deposited");
        }
        totalDeposited = totalDeposited.subtract(amount);
    }

    public ZeroHashTable zeros() {
        return zeros;
    }

    public IncrementalMerkleTree tree() {
        return tree;
    }

    public RootHistory rootHistory() {
        return rootHistory;
    }

    public NullifierSet nullifiers() {
        return nullifiers;
    }

    public MetadataStore metadata() {
        return metadata;
    }

    public BigInteger totalDeposited() {
        return totalDeposited;
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(tree.checkpoint(), rootHistory.checkpoint(), nullifiers.checkpoint(),
                metadata.checkpoint(), totalDeposited);
    }

    public void rollback(Checkpoint checkpoint) {
        tree.rollback(checkpoint.tree);
        rootHistory.rollback(checkpoint.roots);
        nullifiers.rollback(checkpoint.nullifiers);
        metadata.rollback(checkpoint.metadata);
        totalDeposited = checkpoint.totalDeposited;
    }

    public void commit() {
        metadata.forgetJournal();
    }

    public static final class Checkpoint {
        private final IncrementalMerkleTree.Checkpoint tree;
        private final int roots;
        private final int nullifiers;
        private final int metadata;
        private final BigInteger totalDeposited;

        private Checkpoint(IncrementalMerkleTree.Checkpoint tree, int roots, int nullifiers, int metadata,
                           BigInteger totalDeposited) {
            this.tree = tree;
            this.roots = roots;
            this.nullifiers = nullifiers;
            this.metadata = metadata;
            this.totalDeposited = totalDeposited;
        }
    }

}
