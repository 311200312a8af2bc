package com.sommerph.utxoledger.service.custody;

public class AssetTransferException extends RuntimeException {

    public AssetTransferException(String message) {
        super(message);
    }

}
