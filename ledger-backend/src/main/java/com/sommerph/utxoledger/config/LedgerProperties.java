package com.sommerph.utxoledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Tree tree = new Tree();
    private Metadata metadata = new Metadata();
    private Asset asset = new Asset();
    private Verifier verifier = new Verifier();
    private KeyTypes keyTypes = new KeyTypes();
    private State state = new State();

    @Data
    public static class Tree {
        private int height = 32;
    }

    @Data
    public static class Metadata {
        // payloads must be strictly smaller
        private int maxBytes = 100_000;
    }

    @Data
    public static class Asset {
        private String token;
        private String ledgerAccount = "ledger";
    }

    @Data
    public static class Verifier {
        private String type = "none";
        private String verificationKey;
    }

    @Data
    public static class KeyTypes {
        private boolean secp256r1Enabled = false;
    }

    @Data
    public static class State {
        private Registry registry = new Registry();
        private Storage storage = new Storage();

        @Data
        public static class Registry {
            private String type = "memory";
        }

        @Data
        public static class Storage {
            private String path = "./data/ledger";
        }
    }

}
