package com.sommerph.zkpipeline.repository.registry;

import com.sommerph.zkpipeline.model.registry.ProofRegistryEntry;

public interface ProofRegistry {

    void save(ProofRegistryEntry entry);

    ProofRegistryEntry load(String address);

    boolean exists(String address);

}
