package com.ryuqq.scriptgate.core.contract;

/**
 * 외부 애플리케이션에 보낼 스크립트 명령.
 *
 * <p>호출마다 생성되고 실행 후 폐기되는 불변 값입니다.
 * 스크립트 텍스트는 Command Builder가 만들며, 보간된 사용자 값은
 * {@link com.ryuqq.scriptgate.core.script.ScriptEscaper}로 이스케이프되어 있어야 합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>label:</strong> 로그/상태 조회용 이름 (예: get_todos, update_todo)</li>
 *   <li><strong>script:</strong> 실행할 AppleScript 텍스트</li>
 *   <li><strong>resultShape:</strong> 기대 출력 형태</li>
 *   <li><strong>accessMode:</strong> READ 또는 WRITE</li>
 *   <li><strong>sideEffects:</strong> READ임에도 부수 효과가 있는지 여부 (true면 캐시 안 함)</li>
 *   <li><strong>cacheKey:</strong> READ 결과 캐시 키 (null이면 캐시 안 함)</li>
 *   <li><strong>mutation:</strong> WRITE가 변경하는 대상 (READ는 null)</li>
 *   <li><strong>idempotent:</strong> 두 번 적용돼도 결과가 같은지 (READ 기본 true, WRITE 기본 false)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ScriptCommand read = ScriptCommand.read("get_todos", script, "todos:all");
 * ScriptCommand write = ScriptCommand.write(
 *     "update_todo", script, Mutation.of("todo.update", "ABC123")
 * );
 * </pre>
 *
 * @param label 명령 이름
 * @param script 스크립트 텍스트
 * @param resultShape 기대 출력 형태
 * @param accessMode 접근 모드
 * @param sideEffects 부수 효과 여부
 * @param cacheKey 캐시 키 (null 가능)
 * @param mutation 변경 서술 (READ는 null)
 * @param idempotent 멱등성 힌트
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public record ScriptCommand(
    String label,
    String script,
    ResultShape resultShape,
    AccessMode accessMode,
    boolean sideEffects,
    String cacheKey,
    Mutation mutation,
    boolean idempotent
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 접근 모드와 맞지 않는 필드가 있는 경우
     */
    public ScriptCommand {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (script == null || script.isBlank()) {
            throw new IllegalArgumentException("script cannot be null or blank");
        }
        if (resultShape == null) {
            throw new IllegalArgumentException("resultShape cannot be null");
        }
        if (accessMode == null) {
            throw new IllegalArgumentException("accessMode cannot be null");
        }
        if (cacheKey != null && cacheKey.isBlank()) {
            throw new IllegalArgumentException("cacheKey cannot be blank");
        }
        if (accessMode == AccessMode.WRITE) {
            if (mutation == null) {
                throw new IllegalArgumentException("WRITE command requires a mutation (label: " + label + ")");
            }
            if (cacheKey != null) {
                throw new IllegalArgumentException("WRITE command cannot carry a cacheKey (label: " + label + ")");
            }
        } else if (mutation != null) {
            throw new IllegalArgumentException("READ command cannot carry a mutation (label: " + label + ")");
        }
    }

    /**
     * 캐시되지 않는 READ 명령 생성.
     *
     * @param label 명령 이름
     * @param script 스크립트 텍스트
     * @return ScriptCommand
     */
    public static ScriptCommand read(String label, String script) {
        return new ScriptCommand(label, script, ResultShape.ANY, AccessMode.READ, false, null, null, true);
    }

    /**
     * 캐시 가능한 READ 명령 생성.
     *
     * @param label 명령 이름
     * @param script 스크립트 텍스트
     * @param cacheKey 캐시 키
     * @return ScriptCommand
     */
    public static ScriptCommand read(String label, String script, String cacheKey) {
        return new ScriptCommand(label, script, ResultShape.ANY, AccessMode.READ, false, cacheKey, null, true);
    }

    /**
     * WRITE 명령 생성.
     *
     * @param label 명령 이름
     * @param script 스크립트 텍스트
     * @param mutation 변경 서술
     * @return ScriptCommand
     */
    public static ScriptCommand write(String label, String script, Mutation mutation) {
        return new ScriptCommand(label, script, ResultShape.ANY, AccessMode.WRITE, false, null, mutation, false);
    }

    public ScriptCommand withResultShape(ResultShape resultShape) {
        return new ScriptCommand(label, script, resultShape, accessMode, sideEffects, cacheKey, mutation, idempotent);
    }

    public ScriptCommand withSideEffects(boolean sideEffects) {
        return new ScriptCommand(label, script, resultShape, accessMode, sideEffects, cacheKey, mutation, idempotent);
    }

    public ScriptCommand withCacheKey(String cacheKey) {
        return new ScriptCommand(label, script, resultShape, accessMode, sideEffects, cacheKey, mutation, idempotent);
    }

    /**
     * 멱등성 힌트 지정.
     *
     * <p>타임아웃 후 재시도 여부에는 영향을 주지 않습니다. 비멱등 WRITE가 타임아웃 후
     * 재시도되면 큐가 중복 적용 가능성을 경고로 남깁니다.</p>
     *
     * @param idempotent 멱등 여부
     * @return 새 ScriptCommand
     */
    public ScriptCommand withIdempotent(boolean idempotent) {
        return new ScriptCommand(label, script, resultShape, accessMode, sideEffects, cacheKey, mutation, idempotent);
    }

    public boolean isRead() {
        return accessMode == AccessMode.READ;
    }

    public boolean isWrite() {
        return accessMode == AccessMode.WRITE;
    }

    /**
     * 결과를 캐시할 수 있는 명령인지 확인.
     *
     * @return 부수 효과 없는 READ이며 캐시 키가 있으면 true
     */
    public boolean isCacheable() {
        return accessMode == AccessMode.READ && !sideEffects && cacheKey != null;
    }

    /**
     * 스크립트 텍스트를 제외한 문자열 표현.
     *
     * <p>스크립트에는 사용자 데이터가 포함될 수 있으므로 로그에는 label만 남깁니다.</p>
     */
    @Override
    public String toString() {
        return "ScriptCommand{label=" + label + ", accessMode=" + accessMode
            + ", cacheKey=" + cacheKey + ", mutation=" + mutation + "}";
    }
}
