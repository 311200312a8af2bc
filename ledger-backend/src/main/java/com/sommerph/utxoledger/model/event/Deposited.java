package com.sommerph.utxoledger.model.event;

import com.sommerph.utxoledger.model.ledger.Hash32;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class Deposited implements LedgerEvent {
    private String from;
    private BigInteger amount;
    private Hash32 commitment;
    private long leafIndex;
}
