package com.ryuqq.publisher.adapter.inmemory.registry;

import com.ryuqq.publisher.core.spi.ApprovalProvider;
import com.ryuqq.publisher.core.spi.ApprovalProviderRegistry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link ApprovalProviderRegistry} SPI.
 *
 * <p>Backed by a {@link ConcurrentSkipListMap} so {@link #providerNames()} is always in
 * lexicographic order, independent of registration order.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class InMemoryApprovalProviderRegistry implements ApprovalProviderRegistry {

    private final ConcurrentSkipListMap<String, ApprovalProvider> providers = new ConcurrentSkipListMap<>();

    @Override
    public Optional<ApprovalProvider> find(String providerName) {
        if (providerName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(providerName));
    }

    @Override
    public List<String> providerNames() {
        return List.copyOf(providers.keySet());
    }

    @Override
    public void register(ApprovalProvider provider) {
        if (provider == null) {
            throw new IllegalArgumentException("provider cannot be null");
        }
        String name = provider.providerName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("providerName cannot be null or blank");
        }
        if (providers.putIfAbsent(name, provider) != null) {
            throw new IllegalStateException("Approval provider already registered: " + name);
        }
    }
}
