package com.ryuqq.scriptgate.adapter.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GatewayConfig 유닛 테스트.
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
class GatewayConfigTest {

    @Test
    void 기본값() {
        GatewayConfig config = new GatewayConfig();

        assertThat(config.defaultReadTtl()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.applicationName()).isEqualTo("Things3");
    }

    @Test
    void 실행_확인_스크립트는_이름을_이스케이프() {
        // given
        GatewayConfig config = new GatewayConfig().withApplicationName("My \"App\"");

        // when
        String script = config.applicationRunningScript();

        // then
        assertThat(script).isEqualTo("application \"My \\\"App\\\"\" is running");
    }

    @Test
    void 환경_변수로_덮어쓰기() {
        // when
        GatewayConfig config = GatewayConfig.fromEnvironment(Map.of(
            "SCRIPTGATE_READ_TTL_MS", "5000",
            "SCRIPTGATE_APPLICATION", "Things"
        ));

        // then
        assertThat(config.defaultReadTtlMs()).isEqualTo(5000);
        assertThat(config.applicationName()).isEqualTo("Things");
    }

    @Test
    void 잘못된_값은_예외() {
        assertThatThrownBy(() -> new GatewayConfig().withDefaultReadTtlMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("defaultReadTtlMs must be positive");
        assertThatThrownBy(() -> new GatewayConfig().withApplicationName(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GatewayConfig.fromEnvironment(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("env cannot be null");
    }
}
