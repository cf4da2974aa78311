package com.ryuqq.publisher.adapter.inmemory.registry;

import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.spi.AdapterRegistry;
import com.ryuqq.publisher.core.spi.PlatformAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link AdapterRegistry} SPI.
 *
 * <p>Adapters can be registered, unregistered, enabled and disabled at runtime.
 * A disabled adapter stays registered but {@link #find(Platform)} no longer returns it.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class InMemoryAdapterRegistry implements AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAdapterRegistry.class);

    private final ConcurrentHashMap<Platform, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * Registers (or replaces) an adapter, enabled.
     *
     * @param adapter adapter to register
     */
    public void register(PlatformAdapter adapter) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        if (adapter.platform() == null) {
            throw new IllegalArgumentException("adapter.platform cannot be null");
        }
        Registration previous = registrations.put(adapter.platform(), new Registration(adapter, true));
        if (previous != null) {
            log.warn("Replaced adapter for platform {}", adapter.platform());
        } else {
            log.info("Registered adapter for platform {}", adapter.platform());
        }
    }

    /**
     * @param platform platform id
     * @return true if an adapter was removed
     */
    public boolean unregister(Platform platform) {
        return registrations.remove(platform) != null;
    }

    /**
     * @param platform platform id
     * @return true if the platform is registered
     */
    public boolean enable(Platform platform) {
        return setEnabled(platform, true);
    }

    /**
     * @param platform platform id
     * @return true if the platform is registered
     */
    public boolean disable(Platform platform) {
        return setEnabled(platform, false);
    }

    @Override
    public Optional<PlatformAdapter> find(Platform platform) {
        if (platform == null) {
            return Optional.empty();
        }
        Registration registration = registrations.get(platform);
        if (registration == null || !registration.enabled) {
            return Optional.empty();
        }
        return Optional.of(registration.adapter);
    }

    @Override
    public List<PlatformAdapter> enabledAdapters() {
        return registrations.entrySet().stream()
            .filter(entry -> entry.getValue().enabled)
            .sorted((a, b) -> a.getKey().compareTo(b.getKey()))
            .map(entry -> entry.getValue().adapter)
            .collect(Collectors.toList());
    }

    @Override
    public Set<Platform> registeredPlatforms() {
        return new TreeSet<>(registrations.keySet());
    }

    private boolean setEnabled(Platform platform, boolean enabled) {
        Registration updated = registrations.computeIfPresent(
            platform, (key, current) -> new Registration(current.adapter, enabled)
        );
        return updated != null;
    }

    private record Registration(PlatformAdapter adapter, boolean enabled) {
    }
}
