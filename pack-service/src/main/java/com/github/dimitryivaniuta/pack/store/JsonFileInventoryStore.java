package com.github.dimitryivaniuta.pack.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.pack.domain.model.OwnerAccount;
import com.github.dimitryivaniuta.pack.domain.model.OwnerId;
import com.github.dimitryivaniuta.pack.error.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * One JSON document per owner: {@code <dir>/players/<id>.json} for durable owners and
 * {@code <dir>/anon/<id>.json} for anonymous ones. Writes go to a temp file first and are
 * moved into place atomically.
 */
@Slf4j
public class JsonFileInventoryStore implements InventoryStore {

    private final Path playersDir;
    private final Path anonDir;
    private final ObjectMapper objectMapper;
    private final Map<String, Long> startingBalance;
    private final Clock clock;

    public JsonFileInventoryStore(Path directory, ObjectMapper objectMapper,
                                  Map<String, Long> startingBalance, Clock clock) {
        this.playersDir = directory.resolve("players");
        this.anonDir = directory.resolve("anon");
        this.objectMapper = objectMapper;
        this.startingBalance = startingBalance;
        this.clock = clock;
        try {
            Files.createDirectories(playersDir);
            Files.createDirectories(anonDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create store directory " + directory, e);
        }
        log.info("Inventory store at {}", directory.toAbsolutePath());
    }

    @Override
    public OwnerAccount load(OwnerId owner) {
        Path file = fileOf(owner);
        if (!Files.exists(file)) {
            OwnerAccount fresh = OwnerAccount.fresh(owner, startingBalance, clock.instant());
            save(owner, fresh);
            return fresh;
        }
        try {
            return objectMapper.readValue(file.toFile(), OwnerAccount.class);
        } catch (IOException e) {
            throw new StorageException("Cannot read account " + owner, e);
        }
    }

    @Override
    public void save(OwnerId owner, OwnerAccount account) {
        Path file = fileOf(owner);
        try {
            Path tmp = Files.createTempFile(file.getParent(), owner.value(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), account);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Cannot write account " + owner, e);
        }
    }

    @Override
    public void delete(OwnerId owner) {
        try {
            Files.deleteIfExists(fileOf(owner));
        } catch (IOException e) {
            throw new StorageException("Cannot delete account " + owner, e);
        }
    }

    private Path fileOf(OwnerId owner) {
        return (owner.anonymous() ? anonDir : playersDir).resolve(owner.value() + ".json");
    }
}
