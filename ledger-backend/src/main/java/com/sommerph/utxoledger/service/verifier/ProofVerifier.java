package com.sommerph.utxoledger.service.verifier;

/**
 * Checks that {@code proof} attests to exactly {@code publicValues} under {@code verificationKey}.
 * Implementations throw {@link ProofVerificationException} when it does not.
 */
public interface ProofVerifier {

    void verify(byte[] verificationKey, byte[] publicValues, byte[] proof);

}
