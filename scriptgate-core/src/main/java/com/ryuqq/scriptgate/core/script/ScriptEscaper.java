package com.ryuqq.scriptgate.core.script;

import java.util.regex.Pattern;

/**
 * AppleScript 문자열 리터럴 이스케이프 유틸리티.
 *
 * <p>스크립트에 보간되는 모든 사용자 값은 이 클래스를 거쳐야 합니다.
 * 이스케이프되지 않은 따옴표는 스크립트 문법 오류 또는 스크립트 주입으로 이어집니다.</p>
 *
 * <p><strong>변환 규칙:</strong></p>
 * <ul>
 *   <li>{@code \} → {@code \\}, {@code "} → {@code \"}</li>
 *   <li>줄바꿈/캐리지리턴/탭 → {@code \n}, {@code \r}, {@code \t}</li>
 *   <li>그 외 제어 문자는 제거</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * String script = ScriptEscaper.format(
 *     "tell application \"Things3\" to set name of to do id {} to {}",
 *     todoId, newName
 * );
 * </pre>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class ScriptEscaper {

    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,63}$");
    private static final String PLACEHOLDER = "{}";

    private ScriptEscaper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 문자열 리터럴 내부에 들어갈 텍스트를 이스케이프.
     *
     * @param value 원본 값 (null이면 빈 문자열)
     * @return 따옴표 없이 이스케이프된 텍스트
     */
    public static String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (!Character.isISOControl(c)) {
                        sb.append(c);
                    }
                    break;
            }
        }
        return sb.toString();
    }

    /**
     * 따옴표로 감싼 문자열 리터럴 생성.
     *
     * @param value 원본 값
     * @return {@code "escaped"}
     */
    public static String literal(String value) {
        return "\"" + escape(value) + "\"";
    }

    /**
     * 스크립트 변수 이름 검증.
     *
     * @param name 변수 이름
     * @return 검증된 이름
     * @throws IllegalArgumentException 식별자로 쓸 수 없는 경우
     */
    public static String identifier(String name) {
        if (name == null || !IDENTIFIER_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid script identifier: " + name);
        }
        return name;
    }

    /**
     * 템플릿의 {@code {}} 자리표시자를 순서대로 이스케이프된 리터럴로 치환.
     *
     * @param template 스크립트 템플릿
     * @param values 치환할 값 (각각 {@link #literal(String)}로 변환)
     * @return 완성된 스크립트
     * @throws IllegalArgumentException 자리표시자 수와 값의 수가 다른 경우
     */
    public static String format(String template, Object... values) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        Object[] args = values == null ? new Object[0] : values;
        StringBuilder sb = new StringBuilder(template.length() + 32);
        int from = 0;
        int used = 0;
        int at;
        while ((at = template.indexOf(PLACEHOLDER, from)) >= 0) {
            if (used >= args.length) {
                throw new IllegalArgumentException(
                    "Template has more placeholders than values (values: " + args.length + ")"
                );
            }
            sb.append(template, from, at);
            Object value = args[used++];
            sb.append(literal(value == null ? "" : value.toString()));
            from = at + PLACEHOLDER.length();
        }
        if (used != args.length) {
            throw new IllegalArgumentException(
                "Template has fewer placeholders than values (placeholders: " + used + ", values: " + args.length + ")"
            );
        }
        sb.append(template, from, template.length());
        return sb.toString();
    }
}
