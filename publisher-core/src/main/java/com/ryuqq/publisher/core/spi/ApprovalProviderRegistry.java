package com.ryuqq.publisher.core.spi;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of approval providers by name.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface ApprovalProviderRegistry {

    Optional<ApprovalProvider> find(String providerName);

    /**
     * @return registered provider names in lexicographic order
     */
    List<String> providerNames();

    /**
     * Registers a provider.
     *
     * @param provider provider to add
     * @throws IllegalStateException if a provider with the same name is already registered
     */
    void register(ApprovalProvider provider);
}
