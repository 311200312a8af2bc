package com.sommerph.utxoledger.service.ledger;

import com.sommerph.utxoledger.config.LedgerProperties;
import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.custody.TransferApproval;
import com.sommerph.utxoledger.model.event.*;
import com.sommerph.utxoledger.model.ledger.EncryptedOutput;
import com.sommerph.utxoledger.model.ledger.Hash32;
import com.sommerph.utxoledger.model.ledger.LedgerSnapshot;
import com.sommerph.utxoledger.model.ledger.MerkleProof;
import com.sommerph.utxoledger.model.ledger.PublicOutputs;
import com.sommerph.utxoledger.repository.ledger.LedgerStateRegistry;
import com.sommerph.utxoledger.service.custody.AssetCustody;
import com.sommerph.utxoledger.service.custody.AssetTransferException;
import com.sommerph.utxoledger.service.keytype.KeyTypeRegistry;
import com.sommerph.utxoledger.service.state.LedgerState;
import com.sommerph.utxoledger.service.verifier.ProofVerifier;
import com.sommerph.utxoledger.util.HexUtils;
import com.sommerph.utxoledger.util.PublicValuesCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Applies deposits, transfers and withdrawals to the ledger state.
 * <p>
 * Every mutating call runs under this instance's monitor, so calls are applied in a strict
 * total order. A call either commits all of its effects (tree, root history, nullifiers,
 * metadata, deposited total, persisted state, custody transfers and notifications) or none.
 * <p>
 * Transition intent for proof-bearing calls is decoded from the verified public values
 * only. The proof may be anchored to any root the tree has ever had; the nullifier set
 * alone decides whether the spend is still valid.
 */
@Slf4j
public class LedgerStateMachine {

    private final LedgerStateRegistry registry;
    private final ProofVerifier verifier;
    private final byte[] verificationKey;
    private final KeyTypeRegistry keyTypes;
    private final AssetCustody custody;
    private final ApplicationEventPublisher events;
    private final int maxMetadataBytes;
    private final String assetToken;
    private final LedgerState state;

    public LedgerStateMachine(LedgerProperties properties,
                              LedgerStateRegistry registry,
                              ProofVerifier verifier,
                              KeyTypeRegistry keyTypes,
                              AssetCustody custody,
                              ApplicationEventPublisher events) {
        this.registry = registry;
        this.verifier = verifier;
        String key = properties.getVerifier().getVerificationKey();
        this.verificationKey = key == null || key.isBlank() ? new byte[0] : HexUtils.fromHex(key);
        this.keyTypes = keyTypes;
        this.custody = custody;
        this.events = events;
        this.maxMetadataBytes = properties.getMetadata().getMaxBytes();
        this.assetToken = properties.getAsset().getToken();
        this.state = loadOrCreate(properties.getTree().getHeight());
    }

    private LedgerState loadOrCreate(int treeHeight) {
        if (registry.exists()) {
            LedgerSnapshot snapshot = registry.load();
            if (snapshot.getTreeHeight() != treeHeight) {
                throw new IllegalStateException("Stored tree height " + snapshot.getTreeHeight()
                        + " differs from configured height " + treeHeight);
            }
            LedgerState loaded = LedgerState.fromSnapshot(snapshot);
            log.info("Loaded ledger state: {} leaves, root {}", loaded.tree().nextIndex(), loaded.tree().root());
            return loaded;
        }
        LedgerState genesis = LedgerState.genesis(treeHeight);
        registry.save(genesis.toSnapshot());
        log.info("Created genesis ledger state with tree height {}, root {}", treeHeight, genesis.tree().root());
        return genesis;
    }

    // State-changing operations

    /**
     * Deposits {@code amount} pulled from {@code depositor} behind a new commitment.
     *
     * @return leaf index of the commitment
     */
    public synchronized long deposit(Hash32 commitment, EncryptedOutput ciphertext, BigInteger amount, String depositor) {
        log.info("Deposit {} from {} for commitment {}", amount, depositor, commitment);
        return transact("deposit", call -> {
            validateDeposit(commitment, ciphertext, amount);
            pullCustody(call, depositor, amount, () -> custody.pull(depositor, amount));
            return applyDeposit(call, commitment, ciphertext, amount, depositor);
        });
    }

    /**
     * Same as {@link #deposit} with funds pulled under a signed approval instead of a prior
     * allowance. The approval must name the configured asset and cover {@code amount}.
     */
    public synchronized long depositWithDelegatedApproval(Hash32 commitment, EncryptedOutput ciphertext, BigInteger amount,
                                                          TransferApproval approval, byte[] signature, String depositor) {
        log.info("Deposit {} from {} with delegated approval for commitment {}", amount, depositor, commitment);
        return transact("depositWithDelegatedApproval", call -> {
            validateDeposit(commitment, ciphertext, amount);
            if (approval == null || assetToken == null || !assetToken.equalsIgnoreCase(approval.getToken())) {
                throw new LedgerException(LedgerError.APPROVAL_INVALID, "Approval is not for asset " + assetToken);
            }
            if (approval.getAmount() == null || approval.getAmount().compareTo(amount) < 0) {
                throw new LedgerException(LedgerError.APPROVAL_INVALID, "Approval amount does not cover " + amount);
            }
            pullCustody(call, depositor, amount, () -> custody.pullWithApproval(approval, signature, depositor, amount));
            return applyDeposit(call, commitment, ciphertext, amount, depositor);
        });
    }

    /**
     * Spends the proved nullifiers and appends the proved output commitments.
     */
    public synchronized void submitTransfer(List<EncryptedOutput> encryptedOutputs, byte[] proof, byte[] publicValues) {
        log.info("Submit transfer with {} encrypted outputs", sizeOf(encryptedOutputs));
        transact("submitTransfer", call -> {
            PublicOutputs outputs = admitProof(proof, publicValues);
            applyOutputs(call, encryptedOutputs, outputs.getOutputCommitments());
            return null;
        });
    }

    /**
     * Spends the proved nullifiers, appends proved change outputs and releases {@code amount}
     * to {@code recipient}.
     */
    public synchronized void withdraw(String recipient, BigInteger amount, byte[] proof, byte[] publicValues,
                                      List<EncryptedOutput> changeOutputs) {
        log.info("Withdraw {} to {} with {} change outputs", amount, recipient, sizeOf(changeOutputs));
        transact("withdraw", call -> {
            PublicOutputs outputs = admitProof(proof, publicValues);
            requirePositive(amount);
            if (recipient == null || recipient.isBlank()) {
                throw new LedgerException(LedgerError.INVALID_RECIPIENT, "Recipient is missing");
            }
            if (amount.compareTo(state.totalDeposited()) > 0) {
                throw new LedgerException(LedgerError.INSUFFICIENT_BALANCE,
                        "Withdrawal of " + amount + " exceeds deposited total " + state.totalDeposited());
            }
            applyOutputs(call, changeOutputs, outputs.getOutputCommitments());
            state.debit(amount);
            try {
                custody.release(recipient, amount);
            } catch (AssetTransferException e) {
                throw new LedgerException(LedgerError.ASSET_TRANSFER_FAILED, e.getMessage(), e);
            }
            call.compensations.add(() -> custody.pull(recipient, amount));
            call.events.add(new Withdrawn(recipient, amount));
            return null;
        });
    }

    /**
     * Deposits {@code depositCommitment} and applies a transfer in one call. The deposit is
     * not part of the proved statement and is inserted before the proof is checked, so the
     * proof may be anchored to the root that includes it.
     */
    public synchronized void depositAndTransfer(Hash32 depositCommitment, List<EncryptedOutput> encryptedOutputs,
                                                byte[] proof, byte[] publicValues, BigInteger amount, String depositor) {
        log.info("Deposit {} from {} and transfer with {} encrypted outputs", amount, depositor, sizeOf(encryptedOutputs));
        transact("depositAndTransfer", call -> {
            requireVerifier();
            requireCommitment(depositCommitment);
            requirePositive(amount);
            pullCustody(call, depositor, amount, () -> custody.pull(depositor, amount));
            long index = state.insertCommitment(depositCommitment);
            state.credit(amount);
            call.events.add(new Deposited(depositor, amount, depositCommitment, index));

            PublicOutputs outputs = admitProof(proof, publicValues);
            if (outputs.getOutputCommitments().isEmpty()) {
                throw new LedgerException(LedgerError.EMPTY_OUTPUTS, "Transfer must produce at least one output");
            }
            applyOutputs(call, encryptedOutputs, outputs.getOutputCommitments());
            return null;
        });
    }

    // Read-only queries

    public synchronized Hash32 currentRoot() {
        return state.tree().root();
    }

    public synchronized long nextLeafIndex() {
        return state.tree().nextIndex();
    }

    public synchronized boolean nullifierUsed(Hash32 nullifier) {
        return state.nullifiers().isUsed(nullifier);
    }

    public synchronized boolean isKnownRoot(Hash32 root) {
        return state.rootHistory().contains(root);
    }

    public synchronized BigInteger totalDeposited() {
        return state.totalDeposited();
    }

    public synchronized BigInteger getBalance() {
        return custody.custodiedBalance();
    }

    public synchronized Optional<byte[]> getMetadata(Hash32 commitment) {
        return state.metadata().get(commitment);
    }

    public synchronized Optional<MerkleProof> proveLeaf(long leafIndex) {
        return state.tree().prove(leafIndex);
    }

    public synchronized List<Hash32> leaves(long from, int count) {
        return state.tree().leaves(from, count);
    }

    public synchronized int rootHistorySize() {
        return state.rootHistory().size();
    }

    public int treeHeight() {
        return state.tree().height();
    }

    // Call protocol

    private <T> T transact(String operation, Function<Call, T> body) {
        LedgerState.Checkpoint checkpoint = state.checkpoint();
        Hash32 rootBefore = state.tree().root();
        Call call = new Call();
        T result;
        try {
            result = body.apply(call);
            Hash32 rootAfter = state.tree().root();
            if (!rootAfter.equals(rootBefore)) {
                call.events.add(new RootUpdated(rootBefore, rootAfter));
            }
            persist();
        } catch (RuntimeException | Error e) {
            state.rollback(checkpoint);
            compensate(operation, call, e);
            if (e instanceof LedgerException) {
                log.warn("Reverted {}: {} ({})", operation, ((LedgerException) e).getError(), e.getMessage());
            } else {
                log.error("Reverted {} on unexpected failure", operation, e);
            }
            throw e;
        }
        state.commit();
        log.info("Committed {}: root {}, next index {}", operation, state.tree().root(), state.tree().nextIndex());
        call.events.forEach(events::publishEvent);
        return result;
    }

    private void persist() {
        try {
            registry.save(state.toSnapshot());
        } catch (RuntimeException e) {
            throw new LedgerException(LedgerError.STATE_PERSISTENCE_FAILED, "Failed to persist ledger state", e);
        }
    }

    private void compensate(String operation, Call call, Throwable failure) {
        List<Runnable> undo = new ArrayList<>(call.compensations);
        Collections.reverse(undo);
        for (Runnable step : undo) {
            try {
                step.run();
            } catch (RuntimeException e) {
                log.error("Failed to undo custody transfer of reverted {}", operation, e);
                failure.addSuppressed(e);
            }
        }
    }

    private PublicOutputs admitProof(byte[] proof, byte[] publicValues) {
        requireVerifier();
        try {
            verifier.verify(verificationKey, publicValues, proof);
        } catch (RuntimeException e) {
            throw new LedgerException(LedgerError.PROOF_INVALID, "Proof rejected: " + e.getMessage(), e);
        }
        PublicOutputs outputs = PublicValuesCodec.decode(publicValues);
        state.rootHistory().admit(outputs.getOldRoot());
        for (Hash32 nullifier : outputs.getNullifiers()) {
            state.nullifiers().consume(nullifier);
        }
        return outputs;
    }

    private void applyOutputs(Call call, List<EncryptedOutput> encryptedOutputs, List<Hash32> commitments) {
        List<EncryptedOutput> provided = encryptedOutputs == null ? List.of() : encryptedOutputs;
        if (provided.size() != commitments.size()) {
            throw new LedgerException(LedgerError.CIPHERTEXT_COUNT_MISMATCH,
                    "Got " + provided.size() + " encrypted outputs for " + commitments.size() + " proved commitments");
        }
        for (int i = 0; i < commitments.size(); i++) {
            EncryptedOutput output = provided.get(i);
            Hash32 commitment = commitments.get(i);
            if (output == null || !commitment.equals(output.getCommitment())) {
                throw new LedgerException(LedgerError.COMMITMENT_MISMATCH,
                        "Encrypted output " + i + " does not match proved commitment " + commitment);
            }
            validateCiphertext(output);
            long index = state.insertCommitment(commitment);
            commitOutput(call, output, index);
        }
    }

    private long applyDeposit(Call call, Hash32 commitment, EncryptedOutput ciphertext, BigInteger amount, String depositor) {
        long index = state.insertCommitment(commitment);
        state.credit(amount);
        call.events.add(new Deposited(depositor, amount, commitment, index));
        commitOutput(call, ciphertext, index);
        return index;
    }

    private void commitOutput(Call call, EncryptedOutput output, long index) {
        call.events.add(new OutputCommitted(output.getCommitment(), output.getKeyType(), output.getEphemeralKey(),
                output.getNonce(), output.getCiphertext(), index));
        if (output.hasMetadata()) {
            state.metadata().put(output.getCommitment(), output.getMetadata());
            call.events.add(new MetadataPosted(output.getCommitment(), output.getMetadata().length));
        }
    }

    private void pullCustody(Call call, String depositor, BigInteger amount, Runnable transfer) {
        try {
            transfer.run();
        } catch (AssetTransferException e) {
            throw new LedgerException(LedgerError.ASSET_TRANSFER_FAILED, e.getMessage(), e);
        }
        call.compensations.add(() -> custody.release(depositor, amount));
    }

    private void validateDeposit(Hash32 commitment, EncryptedOutput ciphertext, BigInteger amount) {
        requireCommitment(commitment);
        if (ciphertext == null || !commitment.equals(ciphertext.getCommitment())) {
            throw new LedgerException(LedgerError.COMMITMENT_MISMATCH, "Ciphertext commitment does not match " + commitment);
        }
        requirePositive(amount);
        validateCiphertext(ciphertext);
    }

    private void validateCiphertext(EncryptedOutput output) {
        keyTypes.validate(output.getKeyType(), output.getEphemeralKey());
        if (output.getNonce() == null || output.getNonce().length != EncryptedOutput.NONCE_LENGTH) {
            throw new LedgerException(LedgerError.INVALID_NONCE, "Nonce must be " + EncryptedOutput.NONCE_LENGTH + " bytes");
        }
        if (output.getMetadata() != null && output.getMetadata().length >= maxMetadataBytes) {
            throw new LedgerException(LedgerError.METADATA_TOO_LARGE,
                    "Metadata of " + output.getMetadata().length + " bytes reaches limit " + maxMetadataBytes);
        }
    }

    private void requireVerifier() {
        if (verifier == null) {
            throw new LedgerException(LedgerError.VERIFIER_UNCONFIGURED, "No proof verifier configured");
        }
    }

    private static void requireCommitment(Hash32 commitment) {
        if (commitment == null || commitment.isZero()) {
            throw new LedgerException(LedgerError.INVALID_COMMITMENT, "Commitment must be non-zero");
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerException(LedgerError.INVALID_AMOUNT, "Amount must be positive: " + amount);
        }
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    private static final class Call {
        private final List<LedgerEvent> events = new ArrayList<>();
        private final List<Runnable> compensations = new ArrayList<>();
    }

}
