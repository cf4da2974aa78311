package com.ryuqq.publisher.adapter.inmemory.cache;

import com.ryuqq.publisher.core.codec.JsonCodec;
import com.ryuqq.publisher.core.spi.Cache;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link Cache} SPI for testing and reference purposes.
 *
 * <p>Values are stored as JSON strings produced by {@link JsonCodec}, so every read
 * goes through the same decode path a durable substrate would use. Reusing one
 * instance across two pipeline instances is how tests simulate a process restart.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entries:</strong> ConcurrentHashMap&lt;String, Entry&gt; - JSON value and absolute expiry (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Expiry:</strong> entries are evaluated against the injected {@link Clock} and
 * removed lazily on read. An expired key is indistinguishable from an absent one.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public class InMemoryCache implements Cache {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final JsonCodec codec;

    public InMemoryCache() {
        this(Clock.systemUTC(), JsonCodec.getDefault());
    }

    public InMemoryCache(Clock clock) {
        this(clock, JsonCodec.getDefault());
    }

    public InMemoryCache(Clock clock, JsonCodec codec) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.clock = clock;
        this.codec = codec;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(codec.decode(entry.json, type));
    }

    @Override
    public void set(String key, Object value, long expiresAtEpochMs) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        entries.put(key, new Entry(codec.encode(value), expiresAtEpochMs));
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        entries.remove(key);
    }

    /**
     * Checks whether a live (non-expired) value exists.
     *
     * @param key cache key
     * @return true if present and not expired
     */
    public boolean contains(String key) {
        Entry entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.millis());
    }

    /**
     * Raw JSON stored under a key, for inspection in tests.
     *
     * @param key cache key
     * @return JSON string, or empty if absent or expired
     */
    public Optional<String> rawJson(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.millis())) {
            return Optional.empty();
        }
        return Optional.of(entry.json);
    }

    /**
     * @return live keys in lexicographic order
     */
    public Set<String> keys() {
        long now = clock.millis();
        Set<String> live = new TreeSet<>();
        entries.forEach((key, entry) -> {
            if (!entry.isExpired(now)) {
                live.add(key);
            }
        });
        return live;
    }

    public void clear() {
        entries.clear();
    }

    private record Entry(String json, long expiresAtEpochMs) {

        boolean isExpired(long nowEpochMs) {
            return expiresAtEpochMs <= nowEpochMs;
        }
    }
}
