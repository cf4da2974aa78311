package com.ryuqq.publisher.core.codec;

import com.ryuqq.publisher.core.model.ApprovalRequest;
import com.ryuqq.publisher.core.model.ApprovalStatus;
import com.ryuqq.publisher.core.model.ContentPiece;
import com.ryuqq.publisher.core.model.Continuation;
import com.ryuqq.publisher.core.model.DeliveryOptions;
import com.ryuqq.publisher.core.model.PlanSummary;
import com.ryuqq.publisher.core.model.Platform;
import com.ryuqq.publisher.core.model.ScheduledDeliveryEntry;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JsonCodec 테스트.
 *
 * <p>캐시에 저장되는 타입의 다형성 정보(type, kind)와 시간 필드 표현을 검증합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class JsonCodecTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void encode_ApprovalRequest_WritesTypeAndKindDiscriminators() {
        // Given
        ApprovalRequest<ContentPiece> request = ApprovalRequest.create(
            ContentPiece.of("c1", Platform.TWITTER, "hello"), "default", "agent", NOW,
            ApprovalStatus.PENDING, Continuation.recordApprovalOnly("contentDelivery/scheduled/c1-1"));

        // When
        String json = codec.encode(request);

        // Then
        assertTrue(json.contains("\"type\":\"contentPiece\""), json);
        assertTrue(json.contains("\"kind\":\"recordApprovalOnly\""), json);
        assertTrue(json.contains("\"platform\":\"twitter\""), json);
        assertTrue(json.contains("\"timestamp\":\"2025-01-01T00:00:00Z\""), json);
    }

    @Test
    void decode_ApprovalRequest_RestoresContentAndContinuation() {
        // Given
        ApprovalRequest<ContentPiece> request = ApprovalRequest.create(
            ContentPiece.of("c1", Platform.TWITTER, "hello"), "default", "agent", NOW,
            ApprovalStatus.PENDING, Continuation.publish("c1")).withPlatformId("msg-9");

        // When
        ApprovalRequest<?> decoded = codec.decode(codec.encode(request), ApprovalRequest.class);

        // Then
        assertEquals(request, decoded);
        assertInstanceOf(ContentPiece.class, decoded.content());
        assertInstanceOf(Continuation.Publish.class, decoded.continuation());
    }

    @Test
    void decode_PlanRequest_RestoresPlanSummary() {
        // Given
        PlanSummary plan = new PlanSummary("p1", PlanSummary.Kind.MICRO, "Week 1", "m1", List.of("c1", "c2"), NOW);
        ApprovalRequest<PlanSummary> request = ApprovalRequest.create(plan, "default", "agent", NOW,
            ApprovalStatus.PENDING, Continuation.notifyListener("planner"));

        // When
        ApprovalRequest<?> decoded = codec.decode(codec.encode(request), ApprovalRequest.class);

        // Then
        assertEquals(plan, decoded.content());
        assertEquals(Continuation.NOTIFY, decoded.continuation().kind());
    }

    @Test
    void decode_ScheduledEntry_UsesIsProcessingProperty() {
        // Given
        ScheduledDeliveryEntry entry = ScheduledDeliveryEntry
            .create(ContentPiece.of("c1", Platform.TWITTER, "hello"),
                DeliveryOptions.defaults().withScheduledTime(NOW.plusSeconds(3600)), NOW)
            .markProcessing(NOW);

        // When
        String json = codec.encode(entry);
        ScheduledDeliveryEntry decoded = codec.decode(json, ScheduledDeliveryEntry.class);

        // Then
        assertTrue(json.contains("\"isProcessing\":true"), json);
        assertEquals(entry, decoded);
    }

    @Test
    void decode_ArrayOfRequests_Supported() {
        // Given
        ApprovalRequest<?>[] requests = {
            ApprovalRequest.create(ContentPiece.of("c1", Platform.TWITTER, "a"), "default", "agent", NOW,
                ApprovalStatus.PENDING, null),
            ApprovalRequest.create(ContentPiece.of("c2", Platform.DISCORD, "b"), "default", "agent", NOW,
                ApprovalStatus.PENDING, null)
        };

        // When
        ApprovalRequest<?>[] decoded = codec.decode(codec.encode(requests), ApprovalRequest[].class);

        // Then
        assertEquals(2, decoded.length);
        assertEquals("c2-approval", decoded[1].id());
    }

    @Test
    void decode_MalformedJson_ThrowsCodecException() {
        // When & Then
        assertThrows(JsonCodecException.class, () -> codec.decode("{not json", ScheduledDeliveryEntry.class));
    }
}
