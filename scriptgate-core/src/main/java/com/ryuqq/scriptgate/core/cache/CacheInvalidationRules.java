package com.ryuqq.scriptgate.core.cache;

import com.ryuqq.scriptgate.core.contract.Mutation;
import com.ryuqq.scriptgate.core.spi.ResultCache;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 변경 종류별로 무효화할 캐시 키 접두사를 정의하는 정적 규칙.
 *
 * <p>규칙 값의 {@code {target}}, {@code {parent}}는 {@link Mutation}의 targetId, parentScope로 치환됩니다.
 * 값이 없으면 빈 문자열로 치환되어 더 넓은 접두사가 됩니다
 * (예: {@code todo:{target}} → {@code todo:}, 모든 단건 조회 무효화).</p>
 *
 * <p>규칙에 없는 변경 종류는 캐시 전체를 무효화합니다.</p>
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
public final class CacheInvalidationRules {

    static final String TARGET = "{target}";
    static final String PARENT = "{parent}";

    private static final List<String> TODO_CHANGE = List.of(
        CacheKeys.TODOS_ALL,
        CacheKeys.TODOS_PREFIX + PARENT,
        CacheKeys.TODO_PREFIX + TARGET,
        CacheKeys.LIST_PREFIX,
        CacheKeys.RECENT_PREFIX,
        CacheKeys.SEARCH_PREFIX
    );

    private static final List<String> TODO_MOVE = List.of(
        CacheKeys.TODOS_PREFIX,
        CacheKeys.TODO_PREFIX + TARGET,
        CacheKeys.LIST_PREFIX,
        CacheKeys.RECENT_PREFIX,
        CacheKeys.SEARCH_PREFIX
    );

    private static final List<String> PROJECT_CHANGE = List.of(
        CacheKeys.PROJECTS_ALL,
        CacheKeys.PROJECT_PREFIX + TARGET,
        CacheKeys.TODOS_PREFIX + CacheKeys.PROJECT_PREFIX + TARGET,
        CacheKeys.TODOS_ALL,
        CacheKeys.LIST_PREFIX,
        CacheKeys.RECENT_PREFIX,
        CacheKeys.SEARCH_PREFIX
    );

    private static final List<String> AREA_CHANGE = List.of(
        CacheKeys.AREAS_ALL,
        CacheKeys.AREA_PREFIX + TARGET,
        CacheKeys.PROJECTS_ALL,
        CacheKeys.TODOS_PREFIX + CacheKeys.AREA_PREFIX + TARGET,
        CacheKeys.LIST_PREFIX
    );

    private static final List<String> TAG_CHANGE = List.of(
        CacheKeys.TAGS_ALL,
        CacheKeys.TODOS_PREFIX,
        CacheKeys.TODO_PREFIX,
        CacheKeys.LIST_PREFIX,
        CacheKeys.SEARCH_PREFIX
    );

    private static final Map<String, List<String>> RULES = Map.ofEntries(
        Map.entry("todo.add", withTags(TODO_CHANGE)),
        Map.entry("todo.update", withTags(TODO_CHANGE)),
        Map.entry("todo.complete", TODO_CHANGE),
        Map.entry("todo.cancel", TODO_CHANGE),
        Map.entry("todo.schedule", TODO_CHANGE),
        Map.entry("todo.delete", TODO_CHANGE),
        Map.entry("todo.move", TODO_MOVE),
        Map.entry("project.add", PROJECT_CHANGE),
        Map.entry("project.update", PROJECT_CHANGE),
        Map.entry("project.complete", PROJECT_CHANGE),
        Map.entry("project.delete", PROJECT_CHANGE),
        Map.entry("area.add", AREA_CHANGE),
        Map.entry("area.update", AREA_CHANGE),
        Map.entry("area.delete", AREA_CHANGE),
        Map.entry("tag.add", TAG_CHANGE),
        Map.entry("tag.update", TAG_CHANGE),
        Map.entry("tag.delete", TAG_CHANGE)
    );

    private CacheInvalidationRules() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 변경에 영향받는 키 접두사 계산.
     *
     * @param mutation 변경 서술
     * @return 접두사 집합, 규칙에 없는 변경 종류면 empty (전체 무효화 필요)
     */
    public static Optional<Set<String>> prefixesFor(Mutation mutation) {
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        List<String> templates = RULES.get(mutation.kind());
        if (templates == null) {
            return Optional.empty();
        }
        String target = mutation.targetId() == null ? "" : mutation.targetId();
        String parent = mutation.parentScope() == null ? "" : mutation.parentScope();

        Set<String> prefixes = new LinkedHashSet<>();
        for (String template : templates) {
            prefixes.add(template.replace(TARGET, target).replace(PARENT, parent));
        }
        return Optional.of(Set.copyOf(prefixes));
    }

    /**
     * 변경에 따라 캐시 무효화.
     *
     * @param mutation 변경 서술
     * @param cache 대상 캐시
     * @return 제거된 항목 수
     */
    public static int apply(Mutation mutation, ResultCache<?> cache) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        Optional<Set<String>> prefixes = prefixesFor(mutation);
        if (prefixes.isEmpty()) {
            int size = cache.size();
            cache.clear();
            return size;
        }
        return cache.invalidatePrefixes(prefixes.get());
    }

    /**
     * 규칙이 정의된 변경 종류인지 확인.
     */
    public static boolean isKnown(String kind) {
        return kind != null && RULES.containsKey(kind);
    }

    private static List<String> withTags(List<String> base) {
        List<String> combined = new ArrayList<>(base);
        combined.add(CacheKeys.TAGS_ALL);
        return List.copyOf(combined);
    }
}
