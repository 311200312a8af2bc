package com.sommerph.utxoledger.repository.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.utxoledger.model.ledger.LedgerSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.*;

/**
 * Stores the ledger state as one JSON document. Writes go to a temporary file that is
 * then moved over the previous state, so a crash leaves either the old or the new state.
 */
@Slf4j
public class JsonFileLedgerStateRegistry implements LedgerStateRegistry {

    private static final String FILE_NAME = "ledger-state.json";

    private final Path storageDir;
    private final ObjectMapper mapper;

    public JsonFileLedgerStateRegistry(String path) throws IOException {
        this.storageDir = Paths.get(path);
        Files.createDirectories(storageDir);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(LedgerSnapshot snapshot) {
        Path target = storageDir.resolve(FILE_NAME);
        Path temp = storageDir.resolve(FILE_NAME + ".tmp");
        try {
            mapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Successfully wrote ledger state: {}", target);
        } catch (IOException e) {
            log.error("Failed to write ledger state: {}", target, e);
            throw new RuntimeException("Failed to write ledger state: " + target, e);
        }
    }

    @Override
    public LedgerSnapshot load() {
        Path path = storageDir.resolve(FILE_NAME);
        log.info("Load ledger state from {}", path);
        try {
            return mapper.readValue(path.toFile(), LedgerSnapshot.class);
        } catch (IOException e) {
            log.error("Failed to read ledger state: {}", path, e);
            throw new RuntimeException("Failed to read ledger state: " + path, e);
        }
    }

    @Override
    public boolean exists() {
        return Files.exists(storageDir.resolve(FILE_NAME));
    }

}
