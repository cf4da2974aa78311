package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.adapter.inmemory.cache.InMemoryCache;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.DeliveryOptions;
import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.model.ScheduledDeliveryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * MaintenanceReaper 유닛 테스트.
 *
 * <p>예약 인덱스 정리 동작을 검증합니다:</p>
 * <ul>
 *   <li>고아 키 제거</li>
 *   <li>유예 기간이 지난 엔트리 삭제</li>
 *   <li>멈춘 처리 플래그 해제</li>
 *   <li>오래된 전달 잠금 정리</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class MaintenanceReaperTest {

    private static final Instant NOW = Instant.parse("2025-01-10T00:00:00Z");

    @Mock
    private ScheduledDeliveryStore store;

    @Mock
    private CacheLock cacheLock;

    private DeliveryScheduler scheduler;
    private DeliveryConfig config;
    private MaintenanceReaper reaper;

    @BeforeEach
    void setUp() {
        TestClock clock = new TestClock(NOW);
        scheduler = new DeliveryScheduler(clock);
        config = new DeliveryConfig();
        reaper = new MaintenanceReaper(store, scheduler, cacheLock, config, clock);
    }

    @Test
    void scan_엔트리가_없는_키는_인덱스에서_제거함() {
        // given
        String live = "contentDelivery/scheduled/c1-1";
        String ghost = "contentDelivery/scheduled/c2-2";
        when(store.keys()).thenReturn(List.of(live, ghost));
        when(store.find(live)).thenReturn(Optional.of(entry(NOW.plus(Duration.ofHours(1)))));
        when(store.find(ghost)).thenReturn(Optional.empty());

        // when
        reaper.scan();

        // then
        verify(store).removeKeys(List.of(ghost));
    }

    @Test
    void scan_유예_기간이_지난_엔트리는_타이머와_함께_삭제함() {
        // given
        String key = "contentDelivery/scheduled/c1-1";
        when(store.keys()).thenReturn(List.of(key));
        when(store.find(key)).thenReturn(Optional.of(entry(NOW.minus(Duration.ofHours(25)))));
        scheduler.schedule("c1-1", NOW.plusSeconds(60), () -> { });
        scheduler.schedule("c1-1-approval", NOW.plusSeconds(30), () -> { });

        // when
        reaper.scan();

        // then
        verify(store).delete(key);
        verify(store).removeKeys(List.of(key));
        assertThat(scheduler.size()).isZero();
    }

    @Test
    void scan_오래_처리중인_엔트리는_플래그를_해제함() {
        // given
        String key = "contentDelivery/scheduled/c1-1";
        ScheduledDeliveryEntry stuck = entry(NOW.plus(Duration.ofHours(1)))
            .markProcessing(NOW.minus(Duration.ofMinutes(31)));
        when(store.keys()).thenReturn(List.of(key));
        when(store.find(key)).thenReturn(Optional.of(stuck));

        // when
        reaper.scan();

        // then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<UnaryOperator<ScheduledDeliveryEntry>> change = ArgumentCaptor.forClass(UnaryOperator.class);
        verify(store).update(eq(key), change.capture());
        ScheduledDeliveryEntry cleared = change.getValue().apply(stuck);
        assertThat(cleared.processing()).isFalse();
        assertThat(cleared.lastProcessed()).isEqualTo(stuck.lastProcessed());
        verify(store).removeKeys(List.of());
    }

    @Test
    void scan_최근에_처리_시작한_엔트리는_그대로_둠() {
        // given
        String key = "contentDelivery/scheduled/c1-1";
        when(store.keys()).thenReturn(List.of(key));
        when(store.find(key)).thenReturn(Optional.of(
            entry(NOW.plus(Duration.ofHours(1))).markProcessing(NOW.minus(Duration.ofMinutes(5)))));

        // when
        reaper.scan();

        // then
        verify(store, never()).update(any(), any());
        verify(store, never()).delete(any());
    }

    @Test
    void scan_엔트리_조회_실패는_키를_유지하고_계속_진행함() {
        // given
        String broken = "contentDelivery/scheduled/c1-1";
        String ghost = "contentDelivery/scheduled/c2-2";
        when(store.keys()).thenReturn(List.of(broken, ghost));
        when(store.find(broken)).thenThrow(new IllegalStateException("cache down"));
        when(store.find(ghost)).thenReturn(Optional.empty());

        // when
        reaper.scan();

        // then
        verify(store).removeKeys(List.of(ghost));
    }

    @Test
    void scan_예약별_전달_잠금_이름으로_정리를_요청함() {
        // given
        String key = "contentDelivery/scheduled/c1-1";
        when(store.keys()).thenReturn(List.of(key));
        when(store.find(key)).thenReturn(Optional.of(entry(NOW.plus(Duration.ofHours(1)))));

        // when
        reaper.scan();

        // then
        verify(cacheLock).cleanupStale(List.of("delivery/c1-1"));
    }

    @Test
    void scan_스캔_도중_추가된_예약_키는_인덱스에_남김() {
        // given
        TestClock clock = new TestClock(NOW);
        String orphan = ScheduledDeliveryStore.keyFor("a-1");
        String added = ScheduledDeliveryStore.keyFor("b-2");
        AtomicReference<ScheduledDeliveryStore> realStore = new AtomicReference<>();
        AtomicBoolean scanning = new AtomicBoolean(false);
        InMemoryCache cache = new InMemoryCache(clock) {
            @Override
            public <T> Optional<T> get(String key, Class<T> type) {
                if (key.equals(orphan) && scanning.compareAndSet(true, false)) {
                    realStore.get().save(added, entry(NOW.plus(Duration.ofHours(1))));
                    realStore.get().addKey(added);
                }
                return super.get(key, type);
            }
        };
        realStore.set(new ScheduledDeliveryStore(cache, clock, config.graceMs()));
        realStore.get().writeIndex(List.of(orphan));
        MaintenanceReaper realReaper = new MaintenanceReaper(realStore.get(), scheduler, cacheLock, config, clock);
        scanning.set(true);

        // when
        realReaper.scan();

        // then
        assertThat(realStore.get().keys()).containsExactly(added);
    }

    private ScheduledDeliveryEntry entry(Instant scheduledTime) {
        return ScheduledDeliveryEntry.create(
            ContentPiece.of("c1", Platform.TWITTER, "hello"),
            DeliveryOptions.defaults().withScheduledTime(scheduledTime),
            NOW.minus(Duration.ofDays(2))
        );
    }
}
