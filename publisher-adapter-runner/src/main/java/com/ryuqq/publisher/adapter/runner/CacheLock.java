package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.spi.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 캐시 기반 경량 상호 배제.
 *
 * <p>{@code lock/<name>} 키를 확인 후 TTL과 함께 설정합니다(check-then-set).
 * 원자적이지 않으므로 강한 배제가 아닌 중복 트리거 완화용입니다.
 * 프로세스가 죽어도 TTL이 지나면 락은 사라지며, {@link #cleanupStale()}은
 * 이 인스턴스가 획득한 락 중 기준 시간을 넘긴 것을 지웁니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Optional&lt;Plan&gt; plan = cacheLock.withLock("microplan/" + masterPlanId, () -&gt; createNextMicroPlan());
 * </pre>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class CacheLock {

    private static final Logger log = LoggerFactory.getLogger(CacheLock.class);

    public static final String KEY_PREFIX = "lock/";

    private final Cache cache;
    private final Clock clock;
    private final LockConfig config;
    private final String ownerId;
    private final Set<String> acquired = ConcurrentHashMap.newKeySet();

    public CacheLock(Cache cache, Clock clock, LockConfig config) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cache = cache;
        this.clock = clock;
        this.config = config;
        this.ownerId = UUID.randomUUID().toString();
    }

    /**
     * 락 획득 시도.
     *
     * @param name 락 이름
     * @return 획득했으면 true
     */
    public boolean tryAcquire(String name) {
        String key = keyFor(name);
        Optional<LockMarker> existing = cache.get(key, LockMarker.class);
        if (existing.isPresent()) {
            log.debug("Lock {} is held by {} since {}", name, existing.get().owner(), existing.get().acquiredAt());
            return false;
        }
        Instant now = clock.instant();
        cache.set(key, new LockMarker(ownerId, now), now.toEpochMilli() + config.timeoutMs());
        acquired.add(name);
        return true;
    }

    public void release(String name) {
        cache.delete(keyFor(name));
        acquired.remove(name);
    }

    /**
     * 락을 잡은 상태로 작업 실행.
     *
     * @param name 락 이름
     * @param work 작업
     * @param <T> 결과 타입
     * @return 결과 (락을 얻지 못했으면 empty)
     */
    public <T> Optional<T> withLock(String name, Supplier<T> work) {
        if (!tryAcquire(name)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(work.get());
        } finally {
            release(name);
        }
    }

    /**
     * 이 인스턴스가 획득한 락 중 기준 시간을 넘긴 락 삭제.
     *
     * @return 삭제한 락 수
     */
    public int cleanupStale() {
        return cleanupStale(Set.of());
    }

    /**
     * 기준 시간을 넘긴 락 삭제.
     *
     * <p>이 인스턴스가 획득한 락과 {@code names}를 함께 검사합니다.
     * 만료를 늦게 반영하는 캐시에서도 오래된 락이 남지 않게 합니다.</p>
     *
     * @param names 추가로 검사할 락 이름
     * @return 삭제한 락 수
     */
    public int cleanupStale(Collection<String> names) {
        Set<String> candidates = new HashSet<>(acquired);
        candidates.addAll(names);
        Instant threshold = clock.instant().minusMillis(config.timeoutMs());
        int removed = 0;
        for (String name : candidates) {
            try {
                Optional<LockMarker> marker = cache.get(keyFor(name), LockMarker.class);
                if (marker.isEmpty()) {
                    acquired.remove(name);
                } else if (marker.get().acquiredAt().isBefore(threshold)) {
                    log.warn("Removing stale lock {} acquired at {}", name, marker.get().acquiredAt());
                    release(name);
                    removed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to check lock {}", name, e);
            }
        }
        return removed;
    }

    public static String keyFor(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return KEY_PREFIX + name;
    }

    /**
     * 캐시에 저장되는 락 표식.
     *
     * @param owner 획득한 인스턴스 ID
     * @param acquiredAt 획득 시각
     */
    public record LockMarker(String owner, Instant acquiredAt) {
    }
}
