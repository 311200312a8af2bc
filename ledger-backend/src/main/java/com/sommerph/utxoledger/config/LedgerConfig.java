package com.sommerph.utxoledger.config;

import com.sommerph.utxoledger.repository.ledger.LedgerStateRegistry;
import com.sommerph.utxoledger.service.custody.InMemoryAssetCustody;
import com.sommerph.utxoledger.service.keytype.EphemeralKeyValidator;
import com.sommerph.utxoledger.service.keytype.KeyTypeRegistry;
import com.sommerph.utxoledger.service.keytype.Secp256k1KeyValidator;
import com.sommerph.utxoledger.service.keytype.Secp256r1KeyValidator;
import com.sommerph.utxoledger.service.ledger.LedgerStateMachine;
import com.sommerph.utxoledger.service.verifier.ProofVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
public class LedgerConfig {

    private final LedgerProperties properties;

    public LedgerConfig(LedgerProperties properties) {
        this.properties = properties;
    }

    @Bean
    public KeyTypeRegistry keyTypeRegistry() {
        List<EphemeralKeyValidator> validators = new ArrayList<>();
        validators.add(new Secp256k1KeyValidator());
        if (properties.getKeyTypes().isSecp256r1Enabled()) {
            validators.add(new Secp256r1KeyValidator());
        }
        log.info("Enabled ephemeral key types: {}", validators.stream().map(EphemeralKeyValidator::keyType).toList());
        return new KeyTypeRegistry(validators);
    }

    @Bean
    public InMemoryAssetCustody assetCustody() {
        return new InMemoryAssetCustody(properties.getAsset().getLedgerAccount(), Clock.systemUTC());
    }

    @Bean
    public LedgerStateMachine ledgerStateMachine(LedgerStateRegistry registry,
                                                 ObjectProvider<ProofVerifier> verifier,
                                                 KeyTypeRegistry keyTypeRegistry,
                                                 InMemoryAssetCustody assetCustody,
                                                 ApplicationEventPublisher publisher) {
        ProofVerifier proofVerifier = verifier.getIfAvailable();
        if (proofVerifier == null) {
            log.warn("No proof verifier configured; transfers and withdrawals will be rejected");
        }
        return new LedgerStateMachine(properties, registry, proofVerifier, keyTypeRegistry, assetCustody, publisher);
    }

}
