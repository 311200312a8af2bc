package com.sommerph.utxoledger.model.event;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class Withdrawn implements LedgerEvent {
    private String to;
    private BigInteger amount;
}
