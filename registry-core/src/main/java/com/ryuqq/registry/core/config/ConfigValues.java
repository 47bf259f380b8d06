package com.ryuqq.registry.core.config;

import java.util.Map;

/**
 * 환경 변수 형태의 Map에서 숫자 설정값을 읽는 유틸리티.
 *
 * <p>값이 없거나 공백이면 기본값을 반환하고, 파싱에 실패하면 키 이름을 포함한
 * {@link IllegalArgumentException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConfigValues {

    private ConfigValues() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static int intValue(Map<String, String> env, String key, int defaultValue) {
        String raw = raw(env, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    public static long longValue(Map<String, String> env, String key, long defaultValue) {
        String raw = raw(env, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer (current: " + raw + ")", e);
        }
    }

    public static double doubleValue(Map<String, String> env, String key, double defaultValue) {
        String raw = raw(env, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + raw + ")", e);
        }
    }

    private static String raw(Map<String, String> env, String key) {
        String raw = env == null ? null : env.get(key);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
