package com.ryuqq.publisher.core.spi;

import com.ryuqq.publisher.core.error.AdapterUnavailableException;
import com.ryuqq.publisher.core.model.Platform;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of platform adapters by platform identifier.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public interface AdapterRegistry {

    /**
     * Finds an enabled adapter.
     *
     * @param platform platform id
     * @return the adapter, or empty if unregistered or disabled
     */
    Optional<PlatformAdapter> find(Platform platform);

    /**
     * Finds an enabled adapter or fails.
     *
     * @param platform platform id
     * @return the adapter
     * @throws AdapterUnavailableException if unregistered or disabled
     */
    default PlatformAdapter require(Platform platform) {
        return find(platform).orElseThrow(() -> new AdapterUnavailableException(platform));
    }

    /**
     * @return every enabled adapter
     */
    List<PlatformAdapter> enabledAdapters();

    /**
     * @return every registered platform, enabled or not
     */
    Set<Platform> registeredPlatforms();
}
