package com.ryuqq.publisher.testkit.contract;

import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.model.PublishResult;
import com.ryuqq.publisher.core.model.ValidationResult;
import com.ryuqq.publisher.core.spi.PlatformAdapter;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * PlatformAdapter test double with a scripted sequence of publish responses.
 *
 * <p>Each publish call consumes the next scripted step: a {@link PublishResult} is returned,
 * a {@link RuntimeException} is thrown. Once the script is empty every call succeeds with
 * {@code <platform>-<contentId>} as the platform post id.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
public final class ScriptedPlatformAdapter implements PlatformAdapter {

    private final Platform platform;
    private final Clock clock;
    private final Deque<Object> script = new ArrayDeque<>();
    private final AtomicInteger publishCount = new AtomicInteger();
    private final List<ContentPiece> published = new CopyOnWriteArrayList<>();
    private volatile List<String> validationErrors = List.of();
    private volatile boolean connected = true;

    public ScriptedPlatformAdapter(Platform platform, Clock clock) {
        if (platform == null) {
            throw new IllegalArgumentException("platform cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.platform = platform;
        this.clock = clock;
    }

    /**
     * Queues failed publish results.
     *
     * @param errors one error message per failing call
     * @return this adapter
     */
    public synchronized ScriptedPlatformAdapter failWith(String... errors) {
        for (String error : errors) {
            script.add(PublishResult.failure(error, clock.instant()));
        }
        return this;
    }

    public synchronized ScriptedPlatformAdapter throwOnNextPublish(RuntimeException exception) {
        script.add(exception);
        return this;
    }

    public ScriptedPlatformAdapter rejectValidation(String... errors) {
        this.validationErrors = List.of(errors);
        return this;
    }

    public ScriptedPlatformAdapter connected(boolean connected) {
        this.connected = connected;
        return this;
    }

    public int publishCount() {
        return publishCount.get();
    }

    public List<ContentPiece> published() {
        return new ArrayList<>(published);
    }

    @Override
    public Platform platform() {
        return platform;
    }

    @Override
    public ValidationResult validateContent(ContentPiece piece) {
        return validationErrors.isEmpty() ? ValidationResult.ok() : ValidationResult.invalid(validationErrors);
    }

    @Override
    public ContentPiece formatContent(ContentPiece piece) {
        return piece.withFormattedContent("[" + platform.getValue() + "] " + piece.generatedContent());
    }

    @Override
    public PublishResult publishContent(ContentPiece piece) {
        publishCount.incrementAndGet();
        Object step;
        synchronized (this) {
            step = script.poll();
        }
        if (step instanceof RuntimeException) {
            throw (RuntimeException) step;
        }
        if (step instanceof PublishResult) {
            return (PublishResult) step;
        }
        published.add(piece);
        String postId = platform.getValue() + "-" + piece.id();
        return PublishResult.success(postId, "https://" + platform.getValue() + ".example/" + postId, clock.instant());
    }

    @Override
    public boolean checkConnection() {
        return connected;
    }
}
