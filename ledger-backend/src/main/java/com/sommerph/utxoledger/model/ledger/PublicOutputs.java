package com.sommerph.utxoledger.model.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * State transition a proof attests to. Instances used for mutation are always decoded
 * from the verified public values, see {@link com.sommerph.utxoledger.util.PublicValuesCodec}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PublicOutputs {

    private Hash32 oldRoot;
    private List<Hash32> nullifiers = new ArrayList<>();
    private List<Hash32> outputCommitments = new ArrayList<>();

}
