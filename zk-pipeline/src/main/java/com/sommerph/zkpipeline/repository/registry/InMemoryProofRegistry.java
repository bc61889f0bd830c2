package com.sommerph.zkpipeline.repository.registry;

import com.sommerph.zkpipeline.model.registry.ProofRegistryEntry;
import com.sommerph.zkpipeline.util.ProofUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryProofRegistry implements ProofRegistry {

    private final Map<String, ProofRegistryEntry> entryStore = new ConcurrentHashMap<>();

    @Override
    public void save(ProofRegistryEntry entry) {
        log.info("Register proof {} for address {}", entry.getProofHash(), entry.getAddress());
        entryStore.put(ProofUtils.addressToFilename(entry.getAddress()), entry);
    }

    @Override
    public ProofRegistryEntry load(String address) {
        return entryStore.get(ProofUtils.addressToFilename(address));
    }

    @Override
    public boolean exists(String address) {
        return entryStore.containsKey(ProofUtils.addressToFilename(address));
    }

}
