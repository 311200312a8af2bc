package com.sommerph.utxoledger.config;

import com.sommerph.utxoledger.repository.ledger.InMemoryLedgerStateRegistry;
import com.sommerph.utxoledger.repository.ledger.JsonFileLedgerStateRegistry;
import com.sommerph.utxoledger.repository.ledger.LedgerStateRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class LedgerStateRegistryConfig {

    private final LedgerProperties properties;

    public LedgerStateRegistryConfig(LedgerProperties properties) {
        this.properties = properties;
    }

    @Bean
    public LedgerStateRegistry ledgerStateRegistry() throws IOException {
        LedgerProperties.State state = properties.getState();
        return switch (state.getRegistry().getType().toLowerCase()) {
            case "json" -> new JsonFileLedgerStateRegistry(state.getStorage().getPath());
            case "memory" -> new InMemoryLedgerStateRegistry();
            default -> throw new IllegalArgumentException("Unsupported ledger state registry type: " + state.getRegistry().getType());
        };
    }

}
