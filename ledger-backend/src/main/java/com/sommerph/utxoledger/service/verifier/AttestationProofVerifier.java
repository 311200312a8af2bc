package com.sommerph.utxoledger.service.verifier;

import com.sommerph.utxoledger.util.HashUtils;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.SignatureDecodeException;

/**
 * Verifies proofs issued by a trusted prover: the verification key is the prover's
 * secp256k1 public key and the proof is its DER-encoded ECDSA signature over
 * {@code keccak256(publicValues)}.
 */
@Slf4j
public class AttestationProofVerifier implements ProofVerifier {

    @Override
    public void verify(byte[] verificationKey, byte[] publicValues, byte[] proof) {
        if (proof == null || proof.length == 0) {
            throw new ProofVerificationException("Proof is empty");
        }
        ECKey proverKey;
        try {
            proverKey = ECKey.fromPublicOnly(verificationKey);
        } catch (IllegalArgumentException e) {
            throw new ProofVerificationException("Verification key is not a secp256k1 public key", e);
        }
        ECKey.ECDSASignature signature;
        try {
            signature = ECKey.ECDSASignature.decodeFromDER(proof);
        } catch (SignatureDecodeException | IllegalArgumentException e) {
            throw new ProofVerificationException("Proof is not a DER-encoded signature", e);
        }
        Sha256Hash digest = Sha256Hash.wrap(HashUtils.keccak256(publicValues));
        if (!proverKey.verify(digest, signature)) {
            log.debug("Attestation signature does not match public values digest {}", digest);
            throw new ProofVerificationException("Proof does not attest to the given public values");
        }
    }

}
