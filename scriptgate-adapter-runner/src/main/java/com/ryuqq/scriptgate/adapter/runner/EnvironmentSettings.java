package com.ryuqq.scriptgate.adapter.runner;

import java.util.Map;

/**
 * {@code SCRIPTGATE_*} 환경 변수 읽기.
 *
 * <p>값이 없거나 비어 있으면 기본값, 숫자가 아니면 IllegalArgumentException.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
final class EnvironmentSettings {

    static final String TIMEOUT_MS = "SCRIPTGATE_TIMEOUT_MS";
    static final String MAX_ATTEMPTS = "SCRIPTGATE_MAX_ATTEMPTS";
    static final String QUEUE_MAX_DEPTH = "SCRIPTGATE_QUEUE_MAX_DEPTH";
    static final String READ_TTL_MS = "SCRIPTGATE_READ_TTL_MS";
    static final String APPLICATION = "SCRIPTGATE_APPLICATION";

    private EnvironmentSettings() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static long longValue(Map<String, String> env, String name, long defaultValue) {
        String raw = raw(env, name);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number (current: " + raw + ")", e);
        }
    }

    static int intValue(Map<String, String> env, String name, int defaultValue) {
        long value = longValue(env, name, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " is out of int range (current: " + value + ")");
        }
        return (int) value;
    }

    static String stringValue(Map<String, String> env, String name, String defaultValue) {
        String raw = raw(env, name);
        return raw == null ? defaultValue : raw;
    }

    private static String raw(Map<String, String> env, String name) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.strip();
    }
}
