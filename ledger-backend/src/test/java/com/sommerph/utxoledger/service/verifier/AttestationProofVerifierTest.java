package com.sommerph.utxoledger.service.verifier;

import com.sommerph.utxoledger.model.ledger.PublicOutputs;
import com.sommerph.utxoledger.util.HashUtils;
import com.sommerph.utxoledger.util.PublicValuesCodec;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sommerph.utxoledger.LedgerTestData.hash;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AttestationProofVerifier Tests")
class AttestationProofVerifierTest {

    private final AttestationProofVerifier verifier = new AttestationProofVerifier();

    private ECKey prover;
    private byte[] publicValues;

    @BeforeEach
    void setUp() {
        prover = new ECKey();
        publicValues = PublicValuesCodec.encode(new PublicOutputs(hash(1), List.of(hash(2)), List.of(hash(3))));
    }

    static byte[] attest(ECKey prover, byte[] publicValues) {
        return prover.sign(Sha256Hash.wrap(HashUtils.keccak256(publicValues))).encodeToDER();
    }

    @Test
    @DisplayName("A signature by the prover over the public values verifies")
    void shouldAcceptAttestation() {
        byte[] proof = attest(prover, publicValues);

        assertThatCode(() -> verifier.verify(prover.getPubKey(), publicValues, proof)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Altered public values are rejected")
    void shouldRejectAlteredPublicValues() {
        byte[] proof = attest(prover, publicValues);
        publicValues[40] ^= 1;

        assertThatThrownBy(() -> verifier.verify(prover.getPubKey(), publicValues, proof))
                .isInstanceOf(ProofVerificationException.class);
    }

    @Test
    @DisplayName("A signature by another key is rejected")
    void shouldRejectForeignSigner() {
        byte[] proof = attest(new ECKey(), publicValues);

        assertThatThrownBy(() -> verifier.verify(prover.getPubKey(), publicValues, proof))
                .isInstanceOf(ProofVerificationException.class);
    }

    @Test
    @DisplayName("Empty or non-DER proofs and bad keys are rejected")
    void shouldRejectGarbage() {
        byte[] proof = attest(prover, publicValues);

        assertThatThrownBy(() -> verifier.verify(prover.getPubKey(), publicValues, new byte[0]))
                .isInstanceOf(ProofVerificationException.class);
        assertThatThrownBy(() -> verifier.verify(prover.getPubKey(), publicValues, new byte[]{1, 2, 3}))
                .isInstanceOf(ProofVerificationException.class);
        assertThatThrownBy(() -> verifier.verify(new byte[33], publicValues, proof))
                .isInstanceOf(ProofVerificationException.class);
    }

}
