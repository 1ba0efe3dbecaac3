package com.ryuqq.scriptgate.core.contract;

import java.util.Locale;

/**
 * 쓰기 명령이 변경하는 대상에 대한 서술.
 *
 * <p>캐시 무효화 규칙은 이 값으로 영향받는 키를 계산합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Mutation.of("todo.update", "ABC123", "project:P1");
 * Mutation.of("project.add");
 * </pre>
 *
 * @param kind 변경 종류 (예: todo.add, todo.update, project.delete)
 * @param targetId 대상 항목 id (null 가능)
 * @param parentScope 상위 범위 (예: project:P1, area:A1, null 가능)
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record Mutation(
    String kind,
    String targetId,
    String parentScope
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind가 null이거나 blank인 경우
     */
    public Mutation {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        kind = kind.strip().toLowerCase(Locale.ROOT);
        if (targetId != null && targetId.isBlank()) {
            targetId = null;
        }
        if (parentScope != null && parentScope.isBlank()) {
            parentScope = null;
        }
    }

    public static Mutation of(String kind) {
        return new Mutation(kind, null, null);
    }

    public static Mutation of(String kind, String targetId) {
        return new Mutation(kind, targetId, null);
    }

    public static Mutation of(String kind, String targetId, String parentScope) {
        return new Mutation(kind, targetId, parentScope);
    }

    /**
     * 변경 종류의 엔티티 부분 (예: {@code todo.update} → {@code todo}).
     *
     * @return 엔티티 이름
     */
    public String entity() {
        int dot = kind.indexOf('.');
        return dot < 0 ? kind : kind.substring(0, dot);
    }
}
