package com.ryuqq.scriptgate.core.cache;

import java.util.Locale;

/**
 * READ 명령 캐시 키 규약.
 *
 * <p>키는 {@code 종류:범위} 형태이며, 무효화 규칙은 접두사로 동작합니다.</p>
 * <ul>
 *   <li>{@code todos:all}, {@code todos:project:P1}, {@code todos:area:A1}</li>
 *   <li>{@code todo:ABC123}</li>
 *   <li>{@code list:today}, {@code list:inbox}</li>
 *   <li>{@code projects:all}, {@code project:P1}, {@code areas:all}, {@code tags:all}</li>
 *   <li>{@code recent:7d}, {@code search:groceries}</li>
 * </ul>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class CacheKeys {

    public static final String TODOS_ALL = "todos:all";
    public static final String TODOS_PREFIX = "todos:";
    public static final String TODO_PREFIX = "todo:";
    public static final String LIST_PREFIX = "list:";
    public static final String PROJECTS_ALL = "projects:all";
    public static final String PROJECT_PREFIX = "project:";
    public static final String AREAS_ALL = "areas:all";
    public static final String AREA_PREFIX = "area:";
    public static final String TAGS_ALL = "tags:all";
    public static final String RECENT_PREFIX = "recent";
    public static final String SEARCH_PREFIX = "search:";

    private CacheKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String todo(String id) {
        return TODO_PREFIX + require(id, "id");
    }

    /**
     * 특정 범위의 할 일 목록 키.
     *
     * @param scope 범위 (예: {@code project:P1})
     * @return {@code todos:project:P1}
     */
    public static String todosIn(String scope) {
        return TODOS_PREFIX + require(scope, "scope");
    }

    public static String list(String name) {
        return LIST_PREFIX + require(name, "name").toLowerCase(Locale.ROOT);
    }

    public static String project(String id) {
        return PROJECT_PREFIX + require(id, "id");
    }

    public static String area(String id) {
        return AREA_PREFIX + require(id, "id");
    }

    public static String recent(String period) {
        return RECENT_PREFIX + ":" + require(period, "period");
    }

    public static String search(String query) {
        return SEARCH_PREFIX + require(query, "query").strip().toLowerCase(Locale.ROOT);
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
        return value;
    }
}
