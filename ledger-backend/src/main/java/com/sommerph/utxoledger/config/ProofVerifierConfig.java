package com.sommerph.utxoledger.config;

import com.sommerph.utxoledger.service.verifier.AttestationProofVerifier;
import com.sommerph.utxoledger.service.verifier.ProofVerifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Verifier selection. With {@code ledger.verifier.type=none} no verifier bean exists and
 * every proof-bearing call fails as unconfigured.
 */
@Configuration
public class ProofVerifierConfig {

    @Bean
    @ConditionalOnProperty(prefix = "ledger.verifier", name = "type", havingValue = "attestation")
    public ProofVerifier attestationProofVerifier() {
        return new AttestationProofVerifier();
    }

}
