package com.ryuqq.publisher.adapter.runner;

import com.ryuqq.publisher.core.model.DeliveryOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ApprovalConfig / DeliveryConfig 프로퍼티 로딩 테스트.
 *
 * @author Publisher Team
 * @since 1.0.0
 */
class ConfigTest {

    @Test
    void ApprovalConfig_기본값() {
        ApprovalConfig config = new ApprovalConfig();

        assertThat(config.enabled()).isTrue();
        assertThat(config.autoApprove()).isFalse();
        assertThat(config.autoRejectAge()).isEqualTo(Duration.ofDays(7));
        assertThat(config.checkIntervalMs()).isEqualTo(60_000);
        assertThat(config.defaultProviderName()).isEqualTo("default");
    }

    @Test
    void ApprovalConfig_fromProperties_값을_읽어옴() {
        // given
        Properties properties = new Properties();
        properties.setProperty("APPROVAL_ENABLED", "no");
        properties.setProperty("APPROVAL_AUTOAPPROVE", "true");
        properties.setProperty("AUTO_REJECT_DAYS", "3");
        properties.setProperty("APPROVAL_CHECK_INTERVAL", "5");
        properties.setProperty("PLATFORM_PROVIDER_MAPPING", "Twitter=slack, discord=email,broken");

        // when
        ApprovalConfig config = ApprovalConfig.fromProperties(properties);

        // then
        assertThat(config.enabled()).isFalse();
        assertThat(config.autoApprove()).isTrue();
        assertThat(config.autoRejectDays()).isEqualTo(3);
        assertThat(config.checkIntervalMs()).isEqualTo(Duration.ofMinutes(5).toMillis());
        assertThat(config.platformProviderMapping()).isEqualTo(Map.of("twitter", "slack", "discord", "email"));
    }

    @Test
    void ApprovalConfig_fromProperties_잘못된_값은_기본값_사용() {
        // given
        Properties properties = new Properties();
        properties.setProperty("APPROVAL_ENABLED", "maybe");
        properties.setProperty("AUTO_REJECT_DAYS", "seven");

        // when
        ApprovalConfig config = ApprovalConfig.fromProperties(properties);

        // then
        assertThat(config.enabled()).isTrue();
        assertThat(config.autoRejectDays()).isEqualTo(7);
    }

    @Test
    void ApprovalConfig_callback_max가_base보다_작으면_예외() {
        assertThatThrownBy(() -> new ApprovalConfig().withCallbackRetry(3, 100, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("callbackMaxDelayMs");
    }

    @Test
    void DeliveryConfig_fromProperties_기본_옵션을_덮어씀() {
        // given
        Properties properties = new Properties();
        properties.setProperty("DELIVERY_RETRY", "false");
        properties.setProperty("DELIVERY_MAX_RETRIES", "5");
        properties.setProperty("DELIVERY_SKIP_APPROVAL", "on");
        properties.setProperty("DELIVERY_APPROVAL_OFFSET_MINUTES", "30");
        properties.setProperty("DELIVERY_MAINTENANCE_INTERVAL_MINUTES", "60");

        // when
        DeliveryConfig config = DeliveryConfig.fromProperties(properties);

        // then
        DeliveryOptions options = config.defaultOptions();
        assertThat(options.retry()).isFalse();
        assertThat(options.maxRetries()).isEqualTo(5);
        assertThat(options.attemptLimit()).isEqualTo(1);
        assertThat(options.skipApproval()).isTrue();
        assertThat(options.approvalOffsetMs()).isEqualTo(Duration.ofMinutes(30).toMillis());
        assertThat(config.maintenanceIntervalMs()).isEqualTo(Duration.ofHours(1).toMillis());
        assertThat(config.monitorIntervalMs()).isEqualTo(Duration.ofMinutes(15).toMillis());
    }

    @Test
    void DeliveryConfig_부분_옵션은_기본값과_병합됨() {
        // when
        DeliveryConfig config = new DeliveryConfig().withDefaultOptions(DeliveryOptions.empty().withMaxRetries(2));

        // then
        assertThat(config.defaultOptions().maxRetries()).isEqualTo(2);
        assertThat(config.defaultOptions().retry()).isTrue();
        assertThat(config.defaultOptions().approvalOffsetMs()).isEqualTo(DeliveryOptions.DEFAULT_APPROVAL_OFFSET_MS);
    }
}
