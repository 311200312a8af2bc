package com.sommerph.utxoledger.service.custody;

import com.sommerph.utxoledger.model.custody.TransferApproval;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Account-based custody kept in memory. Approvals are single use per depositor nonce.
 */
@Slf4j
public class InMemoryAssetCustody implements AssetCustody {

    private final String ledgerAccount;
    private final Clock clock;
    private final Map<String, BigInteger> accounts = new ConcurrentHashMap<>();
    private final Map<String, Set<BigInteger>> usedNonces = new ConcurrentHashMap<>();

    public InMemoryAssetCustody(String ledgerAccount, Clock clock) {
        this.ledgerAccount = ledgerAccount;
        this.clock = clock;
    }

    /** Adds funds to an external account. The ledger account only changes through pull and release. */
    public synchronized void fund(String account, BigInteger amount) {
        if (account == null || account.equals(ledgerAccount)) {
            throw new AssetTransferException("Cannot fund account " + account);
        }
        log.info("Fund account {} with {}", account, amount);
        accounts.merge(account, amount, BigInteger::add);
    }

    public BigInteger balanceOf(String account) {
        return accounts.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized void pull(String from, BigInteger amount) {
        move(from, ledgerAccount, amount);
    }

    @Override
    public synchronized void pullWithApproval(TransferApproval approval, byte[] signature, String depositor, BigInteger amount) {
        if (signature == null || signature.length == 0) {
            throw new AssetTransferException("Approval signature is missing");
        }
        if (approval.getDeadline() < clock.instant().getEpochSecond()) {
            throw new AssetTransferException("Approval expired at " + approval.getDeadline());
        }
        Set<BigInteger> nonces = usedNonces.computeIfAbsent(depositor, k -> new HashSet<>());
        if (nonces.contains(approval.getNonce())) {
            throw new AssetTransferException("Approval nonce already used: " + approval.getNonce());
        }
        move(depositor, ledgerAccount, amount);
        nonces.add(approval.getNonce());
    }

    @Override
    public synchronized void release(String to, BigInteger amount) {
        move(ledgerAccount, to, amount);
    }

    @Override
    public BigInteger custodiedBalance() {
        return balanceOf(ledgerAccount);
    }

    private void move(String from, String to, BigInteger amount) {
        if (from == null || to == null) {
            throw new AssetTransferException("Transfer account is missing");
        }
        if (from.equals(to)) {
            throw new AssetTransferException("Transfer from " + from + " to itself");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new AssetTransferException("Transfer amount must be positive");
        }
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            throw new AssetTransferException("Insufficient funds in " + from + ": " + available + " < " + amount);
        }
        accounts.put(from, available.subtract(amount));
        accounts.merge(to, amount, BigInteger::add);
        log.debug("Moved {} from {} to {}", amount, from, to);
    }

}
