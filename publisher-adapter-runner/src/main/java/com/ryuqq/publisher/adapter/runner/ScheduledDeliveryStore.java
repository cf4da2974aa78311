package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.model.ScheduledDeliveryEntry;
import com.ryuqq.publisher.core.spi.Cache;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * 예약 게시 항목의 캐시 저장소.
 *
 * <p>캐시는 접두사 스캔을 지원하지 않으므로 모든 항목 키를
 * {@value #INDEX_KEY}에 배열로 따로 보관합니다.</p>
 *
 * <p><strong>키 형식:</strong></p>
 * <ul>
 *   <li>항목: {@code contentDelivery/scheduled/<contentId>-<scheduledEpochMs>}</li>
 *   <li>색인: {@code contentDelivery/scheduledKeys}</li>
 * </ul>
 *
 * <p>항목의 만료는 {@code scheduledTime + grace}이며, 색인은 가장 늦은 항목과 같이 만료됩니다.
 * 색인 갱신은 이 프로세스 안에서만 직렬화되며 프로세스 간 경합은 유지보수 스윕이 정리합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class ScheduledDeliveryStore {

    public static final String KEY_PREFIX = "contentDelivery/scheduled/";
    public static final String INDEX_KEY = "contentDelivery/scheduledKeys";

    private final Cache cache;
    private final Clock clock;
    private final long graceMs;
    private final Object indexLock = new Object();

    public ScheduledDeliveryStore(Cache cache, Clock clock, long graceMs) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (graceMs <= 0) {
            throw new IllegalArgumentException("graceMs must be positive (current: " + graceMs + ")");
        }
        this.cache = cache;
        this.clock = clock;
        this.graceMs = graceMs;
    }

    /**
     * @param contentId 콘텐츠 ID
     * @param scheduledTime 예약 시각
     * @return {@code <contentId>-<scheduledEpochMs>}
     */
    public static String scheduledId(String contentId, Instant scheduledTime) {
        return contentId + "-" + scheduledTime.toEpochMilli();
    }

    public static String keyFor(String scheduledId) {
        return KEY_PREFIX + scheduledId;
    }

    public static String scheduledIdOf(String key) {
        return key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
    }

    public Optional<ScheduledDeliveryEntry> find(String key) {
        return cache.get(key, ScheduledDeliveryEntry.class);
    }

    /**
     * 항목 전체 상태 저장.
     */
    public void save(String key, ScheduledDeliveryEntry entry) {
        cache.set(key, entry, entry.expiresAtEpochMs(graceMs));
    }

    /**
     * 읽기-수정-쓰기. 항목이 없으면 아무것도 쓰지 않습니다.
     *
     * @param key 항목 키
     * @param change 변경 함수
     * @return 저장된 항목 (없었으면 empty)
     */
    public Optional<ScheduledDeliveryEntry> update(String key, UnaryOperator<ScheduledDeliveryEntry> change) {
        Optional<ScheduledDeliveryEntry> current = find(key);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        ScheduledDeliveryEntry updated = change.apply(current.get());
        save(key, updated);
        return Optional.of(updated);
    }

    public void delete(String key) {
        cache.delete(key);
    }

    public List<String> keys() {
        return cache.get(INDEX_KEY, String[].class)
            .map(array -> new ArrayList<>(Arrays.asList(array)))
            .orElseGet(ArrayList::new);
    }

    public void addKey(String key) {
        synchronized (indexLock) {
            List<String> keys = keys();
            if (!keys.contains(key)) {
                keys.add(key);
                writeIndexLocked(keys);
            }
        }
    }

    public void removeKey(String key) {
        synchronized (indexLock) {
            List<String> keys = keys();
            if (keys.remove(key)) {
                writeIndexLocked(keys);
            }
        }
    }

    /**
     * 색인에서 여러 키 제거.
     *
     * <p>색인을 잠금 안에서 다시 읽어 걸러내므로 스캔 도중 추가된 키는 유지됩니다.</p>
     *
     * @param removed 제거할 키
     * @return 실제로 제거된 키 수
     */
    public int removeKeys(Collection<String> removed) {
        if (removed == null || removed.isEmpty()) {
            return 0;
        }
        synchronized (indexLock) {
            List<String> keys = keys();
            int before = keys.size();
            keys.removeAll(removed);
            int count = before - keys.size();
            if (count > 0) {
                writeIndexLocked(keys);
            }
            return count;
        }
    }

    /**
     * 색인을 주어진 키로 교체.
     *
     * @param keys 유지할 키 목록
     */
    public void writeIndex(List<String> keys) {
        synchronized (indexLock) {
            writeIndexLocked(new ArrayList<>(keys));
        }
    }

    private void writeIndexLocked(List<String> keys) {
        if (keys.isEmpty()) {
            cache.delete(INDEX_KEY);
            return;
        }
        Instant latest = clock.instant();
        for (String key : keys) {
            Optional<ScheduledDeliveryEntry> entry = find(key);
            if (entry.isPresent() && entry.get().scheduledTime().isAfter(latest)) {
                latest = entry.get().scheduledTime();
            }
        }
        cache.set(INDEX_KEY, keys.toArray(new String[0]), latest.toEpochMilli() + graceMs);
    }
}
