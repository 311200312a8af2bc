package com.sommerph.utxoledger.model.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inclusion path of a leaf: one sibling per level, leaf level first.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MerkleProof {
    private long leafIndex;
    private List<Hash32> siblings;
}
