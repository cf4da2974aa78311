package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.application.runtime.Runtime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 프로세스당 하나인 타이머 서비스.
 *
 * <p>(fireAt, taskId) 최소 힙과 taskId → 타이머 맵으로 구성되며, 하나의 락으로 보호됩니다.
 * {@link #pump()}가 기한이 된 타이머를 발화 시각 순서로 꺼내 태스크 본문을
 * 주입된 {@link Executor}에서 실행합니다.</p>
 *
 * <p><strong>동작 규칙:</strong></p>
 * <ul>
 *   <li>schedule(): 같은 taskId가 있으면 교체 (이전 타이머는 발화하지 않음)</li>
 *   <li>cancel(): 멱등 (없는 taskId 취소는 no-op)</li>
 *   <li>같은 발화 시각이면 먼저 등록한 타이머가 먼저 발화</li>
 *   <li>태스크 본문 예외는 로그만 남기고 다른 타이머에 영향 없음</li>
 * </ul>
 *
 * <p><strong>실행 모드:</strong></p>
 * <ul>
 *   <li>운영: {@link #start(Duration)}가 단일 스케줄링 스레드에서 tick마다 pump() 호출</li>
 *   <li>테스트: 수동 Clock을 전진시킨 뒤 pump() 직접 호출, {@code Runnable::run} Executor 사용</li>
 * </ul>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class DeliveryScheduler implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(DeliveryScheduler.class);

    private final Clock clock;
    private final Executor taskExecutor;

    private final Object lock = new Object();
    private final PriorityQueue<Timer> queue = new PriorityQueue<>();
    private final Map<String, Timer> timers = new HashMap<>();
    private final Set<String> repeating = new HashSet<>();
    private long sequence;

    private ScheduledExecutorService ticker;

    /**
     * 호출 스레드에서 태스크를 실행하는 스케줄러 생성.
     *
     * @param clock 시계
     */
    public DeliveryScheduler(Clock clock) {
        this(clock, Runnable::run);
    }

    /**
     * 생성자.
     *
     * @param clock 시계
     * @param taskExecutor 태스크 본문 실행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DeliveryScheduler(Clock clock, Executor taskExecutor) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (taskExecutor == null) {
            throw new IllegalArgumentException("taskExecutor cannot be null");
        }
        this.clock = clock;
        this.taskExecutor = taskExecutor;
    }

    /**
     * 타이머 등록 (같은 taskId는 교체).
     *
     * @param taskId 타이머 ID
     * @param fireAt 발화 시각
     * @param body 태스크 본문
     */
    public void schedule(String taskId, Instant fireAt, Runnable body) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        if (fireAt == null) {
            throw new IllegalArgumentException("fireAt cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        synchronized (lock) {
            Timer timer = new Timer(taskId, fireAt, sequence++, body);
            Timer previous = timers.put(taskId, timer);
            if (previous != null) {
                queue.remove(previous);
                log.debug("Replaced timer {} ({} → {})", taskId, previous.fireAt, fireAt);
            }
            queue.add(timer);
        }
    }

    /**
     * 고정 지연 반복 타이머 등록.
     *
     * <p>본문 실행이 끝나면 {@code now + interval}로 다시 등록됩니다.
     * {@link #cancel(String)}하면 반복도 중단됩니다.</p>
     *
     * @param taskId 타이머 ID
     * @param interval 반복 간격 (양수)
     * @param body 태스크 본문
     */
    public void scheduleWithFixedDelay(String taskId, Duration interval, Runnable body) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
        synchronized (lock) {
            repeating.add(taskId);
        }
        schedule(taskId, clock.instant().plus(interval), new Runnable() {
            @Override
            public void run() {
                try {
                    body.run();
                } finally {
                    boolean active;
                    synchronized (lock) {
                        active = repeating.contains(taskId) && !timers.containsKey(taskId);
                    }
                    if (active) {
                        schedule(taskId, clock.instant().plus(interval), this);
                    }
                }
            }
        });
    }

    /**
     * 타이머 취소 (멱등).
     *
     * @param taskId 타이머 ID
     * @return 대기 중인 타이머가 있었으면 true
     */
    public boolean cancel(String taskId) {
        synchronized (lock) {
            repeating.remove(taskId);
            Timer removed = timers.remove(taskId);
            if (removed != null) {
                queue.remove(removed);
                return true;
            }
            return false;
        }
    }

    public boolean isScheduled(String taskId) {
        synchronized (lock) {
            return timers.containsKey(taskId);
        }
    }

    public Optional<Instant> fireTimeOf(String taskId) {
        synchronized (lock) {
            Timer timer = timers.get(taskId);
            return timer == null ? Optional.empty() : Optional.of(timer.fireAt);
        }
    }

    public int size() {
        synchronized (lock) {
            return timers.size();
        }
    }

    /**
     * 기한이 된 타이머를 모두 발화.
     *
     * <p>태스크가 실행 중에 현재 시각 이전으로 등록한 타이머도 같은 호출에서 발화합니다.</p>
     *
     * @return 발화한 타이머 수
     */
    @Override
    public int pump() {
        Instant now = clock.instant();
        int fired = 0;
        while (true) {
            Timer due;
            synchronized (lock) {
                Timer head = queue.peek();
                if (head == null || head.fireAt.isAfter(now)) {
                    break;
                }
                due = queue.poll();
                if (timers.get(due.taskId) != due) {
                    continue;
                }
                timers.remove(due.taskId);
            }
            fired++;
            taskExecutor.execute(() -> runSafely(due));
        }
        return fired;
    }

    /**
     * tick 간격으로 pump()를 호출하는 스케줄링 스레드 시작.
     *
     * @param tick pump 간격
     * @throws IllegalStateException 이미 시작된 경우
     */
    public void start(Duration tick) {
        if (tick == null || tick.isZero() || tick.isNegative()) {
            throw new IllegalArgumentException("tick must be positive (current: " + tick + ")");
        }
        synchronized (lock) {
            if (ticker != null) {
                throw new IllegalStateException("DeliveryScheduler already started");
            }
            ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "delivery-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            ticker.scheduleWithFixedDelay(this::pumpSafely, 0, tick.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("DeliveryScheduler started (tick: {}ms)", tick.toMillis());
    }

    /**
     * 스케줄링 스레드 중지. 대기 중인 타이머는 유지됩니다.
     */
    public void stop() {
        ScheduledExecutorService current;
        synchronized (lock) {
            current = ticker;
            ticker = null;
        }
        if (current != null) {
            current.shutdownNow();
            log.info("DeliveryScheduler stopped");
        }
    }

    /**
     * 모든 타이머 제거.
     *
     * @return 제거된 taskId 목록
     */
    public List<String> clear() {
        synchronized (lock) {
            List<String> cleared = new ArrayList<>(timers.keySet());
            timers.clear();
            queue.clear();
            repeating.clear();
            return cleared;
        }
    }

    private void pumpSafely() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("DeliveryScheduler pump failed", e);
        }
    }

    private void runSafely(Timer timer) {
        try {
            timer.body.run();
        } catch (RuntimeException e) {
            log.error("Timer {} failed", timer.taskId, e);
        }
    }

    private static final class Timer implements Comparable<Timer> {

        private final String taskId;
        private final Instant fireAt;
        private final long sequence;
        private final Runnable body;

        private Timer(String taskId, Instant fireAt, long sequence, Runnable body) {
            this.taskId = taskId;
            this.fireAt = fireAt;
            this.sequence = sequence;
            this.body = body;
        }

        @Override
        public int compareTo(Timer other) {
            int byTime = fireAt.compareTo(other.fireAt);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }
}
