package com.ryuqq.scriptgate.core.contract;

import java.util.regex.Pattern;

/**
 * 스크립트 출력의 기대 형태.
 *
 * <p>Executor는 성공한 호출의 출력을 이 형태로 검증하고, 불일치 시
 * {@code UNEXPECTED_RESULT}로 보고합니다. 출력은 앞뒤 공백을 제거한 뒤 검사합니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public enum ResultShape {

    /**
     * 어떤 출력이든 허용 (빈 출력 포함).
     */
    ANY {
        @Override
        public boolean accepts(String output) {
            return output != null;
        }
    },

    /**
     * 비어 있지 않은 텍스트.
     */
    TEXT {
        @Override
        public boolean accepts(String output) {
            return output != null && !output.isBlank();
        }
    },

    /**
     * 공백 없는 단일 토큰 (예: 생성된 항목의 id).
     */
    IDENTIFIER {
        @Override
        public boolean accepts(String output) {
            return output != null && IDENTIFIER_PATTERN.matcher(output.strip()).matches();
        }
    },

    /**
     * {@code true} 또는 {@code false}.
     */
    BOOLEAN {
        @Override
        public boolean accepts(String output) {
            if (output == null) {
                return false;
            }
            String value = output.strip();
            return "true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value);
        }
    },

    /**
     * 정수.
     */
    INTEGER {
        @Override
        public boolean accepts(String output) {
            return output != null && INTEGER_PATTERN.matcher(output.strip()).matches();
        }
    },

    /**
     * 날짜 숫자 속성 형식 ({@code year:2025 month:1 day:15 ...}).
     */
    DATE_FIELDS {
        @Override
        public boolean accepts(String output) {
            return output != null && DATE_FIELDS_PATTERN.matcher(output.strip()).find();
        }
    };

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^\\S+$");
    private static final Pattern INTEGER_PATTERN = Pattern.compile("^-?\\d+$");
    private static final Pattern DATE_FIELDS_PATTERN =
        Pattern.compile("year\\s*:\\s*\\d+\\s*,?\\s*month\\s*:\\s*\\d+\\s*,?\\s*day\\s*:\\s*\\d+");

    /**
     * 출력이 이 형태를 만족하는지 확인.
     *
     * @param output 엔진 출력
     * @return 만족하면 true
     */
    public abstract boolean accepts(String output);
}
