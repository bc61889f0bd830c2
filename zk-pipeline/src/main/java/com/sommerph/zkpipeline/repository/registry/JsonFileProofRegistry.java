package com.sommerph.zkpipeline.repository.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.zkpipeline.model.registry.ProofRegistryEntry;
import com.sommerph.zkpipeline.util.ProofUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.*;

/**
 * One JSON file per address, named after the address without its {@code 0x} prefix.
 */
@Slf4j
public class JsonFileProofRegistry implements ProofRegistry {

    private final Path storageDir;
    private final ObjectMapper mapper;

    public JsonFileProofRegistry(String storagePath) throws IOException {
        this.storageDir = Paths.get(storagePath);
        Files.createDirectories(storageDir);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(ProofRegistryEntry entry) {
        log.info("Register proof {} for address {}", entry.getProofHash(), entry.getAddress());
        Path filePath = entryPath(entry.getAddress());
        try {
            mapper.writeValue(filePath.toFile(), entry);
        } catch (IOException e) {
            log.error("Failed to write registry entry for address: {}", entry.getAddress(), e);
            throw new RuntimeException("Failed to write registry entry for address: " + entry.getAddress(), e);
        }
    }

    @Override
    public ProofRegistryEntry load(String address) {
        log.info("Load registry entry for address {}", address);
        Path filePath = entryPath(address);
        try {
            return mapper.readValue(filePath.toFile(), ProofRegistryEntry.class);
        } catch (IOException e) {
            log.error("Failed to read registry entry for address: {}", address, e);
            throw new RuntimeException("Failed to read registry entry for address: " + address, e);
        }
    }

    @Override
    public boolean exists(String address) {
        return Files.exists(entryPath(address));
    }

    private Path entryPath(String address) {
        return storageDir.resolve(ProofUtils.addressToFilename(address) + ".json");
    }

}
