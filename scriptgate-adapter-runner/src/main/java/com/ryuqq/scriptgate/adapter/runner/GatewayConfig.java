package com.ryuqq.scriptgate.adapter.runner;

import com.ryuqq.scriptgate.core.script.ScriptEscaper;

import java.time.Duration;
import java.util.Map;

/**
 * RoutingCommandGateway 설정 (불변 record).
 *
 * <ul>
 *   <li>defaultReadTtlMs: 캐시 가능한 READ 결과의 TTL (기본 30000ms)</li>
 *   <li>applicationName: 실행 여부 확인 대상 애플리케이션 이름 (기본 {@code Things3})</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 * @param defaultReadTtlMs READ 결과 TTL (밀리초, 양수여야 함)
 * @param applicationName 애플리케이션 이름 (비어 있으면 안 됨)
 */
public record GatewayConfig(long defaultReadTtlMs, String applicationName) {

    public static final String DEFAULT_APPLICATION = "Things3";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultReadTtlMs=30000ms, applicationName=Things3</p>
     */
    public GatewayConfig() {
        this(30000, DEFAULT_APPLICATION);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GatewayConfig {
        if (defaultReadTtlMs <= 0) {
            throw new IllegalArgumentException(
                "defaultReadTtlMs must be positive (current: " + defaultReadTtlMs + ")"
            );
        }
        if (applicationName == null || applicationName.isBlank()) {
            throw new IllegalArgumentException("applicationName cannot be null or blank");
        }
    }

    /**
     * 환경 변수로 기본값을 덮어쓴 설정.
     *
     * <p>{@code SCRIPTGATE_READ_TTL_MS}, {@code SCRIPTGATE_APPLICATION}</p>
     *
     * @param env 환경 변수
     * @return 설정
     * @throws IllegalArgumentException 값이 숫자가 아니거나 검증에 실패한 경우
     */
    public static GatewayConfig fromEnvironment(Map<String, String> env) {
        GatewayConfig defaults = new GatewayConfig();
        return new GatewayConfig(
            EnvironmentSettings.longValue(env, EnvironmentSettings.READ_TTL_MS, defaults.defaultReadTtlMs()),
            EnvironmentSettings.stringValue(env, EnvironmentSettings.APPLICATION, defaults.applicationName())
        );
    }

    public Duration defaultReadTtl() {
        return Duration.ofMillis(defaultReadTtlMs);
    }

    /**
     * 실행 여부 확인 스크립트.
     */
    public String applicationRunningScript() {
        return "application " + ScriptEscaper.literal(applicationName) + " is running";
    }

    /**
     * defaultReadTtlMs만 변경한 새 인스턴스 생성.
     */
    public GatewayConfig withDefaultReadTtlMs(long defaultReadTtlMs) {
        return new GatewayConfig(defaultReadTtlMs, applicationName);
    }

    /**
     * applicationName만 변경한 새 인스턴스 생성.
     */
    public GatewayConfig withApplicationName(String applicationName) {
        return new GatewayConfig(defaultReadTtlMs, applicationName);
    }
}
