package com.sommerph.utxoledger.model.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted form of the committed ledger state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerSnapshot {

    private int treeHeight;

    private List<Hash32> leaves = new ArrayList<>();
    private List<Hash32> filledSubtrees = new ArrayList<>();
    private Hash32 root;

    private List<Hash32> rootHistory = new ArrayList<>();
    private List<Hash32> nullifiers = new ArrayList<>();

    // commitment hex -> metadata hex
    private Map<String, String> metadata = new LinkedHashMap<>();

    private BigInteger totalDeposited = BigInteger.ZERO;

}
