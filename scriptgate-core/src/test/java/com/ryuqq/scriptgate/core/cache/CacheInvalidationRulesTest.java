package com.ryuqq.scriptgate.core.cache;

import com.ryuqq.scriptgate.core.contract.Mutation;
import com.ryuqq.scriptgate.core.spi.ResultCache;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

/**
 * CacheInvalidationRules 테스트.
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
class CacheInvalidationRulesTest {

    @Test
    void prefixesFor_TodoUpdate_SubstitutesTargetAndParent() {
        // When
        Set<String> prefixes = CacheInvalidationRules
            .prefixesFor(Mutation.of("todo.update", "ABC123", "project:P1"))
            .orElseThrow();

        // Then
        assertTrue(prefixes.contains("todos:all"));
        assertTrue(prefixes.contains("todos:project:P1"));
        assertTrue(prefixes.contains("todo:ABC123"));
        assertTrue(prefixes.contains("recent"));
        assertTrue(prefixes.contains("list:"));
        assertTrue(prefixes.contains("tags:all"));
        prefixes.forEach(prefix -> assertFalse(prefix.contains("{"), prefix));
    }

    @Test
    void prefixesFor_MissingTarget_WidensToWholeFamily() {
        Set<String> prefixes = CacheInvalidationRules.prefixesFor(Mutation.of("todo.complete")).orElseThrow();

        assertTrue(prefixes.contains("todo:"));
        assertTrue(prefixes.contains("todos:"));
    }

    @Test
    void prefixesFor_ProjectDelete_CoversProjectTodos() {
        Set<String> prefixes = CacheInvalidationRules.prefixesFor(Mutation.of("project.delete", "P1")).orElseThrow();

        assertTrue(prefixes.contains("projects:all"));
        assertTrue(prefixes.contains("project:P1"));
        assertTrue(prefixes.contains("todos:project:P1"));
    }

    @Test
    void prefixesFor_UnknownKind_ReturnsEmpty() {
        assertEquals(Optional.empty(), CacheInvalidationRules.prefixesFor(Mutation.of("heading.add")));
        assertFalse(CacheInvalidationRules.isKnown("heading.add"));
        assertTrue(CacheInvalidationRules.isKnown("todo.move"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void apply_KnownKind_InvalidatesPrefixes() {
        // Given
        ResultCache<String> cache = mock(ResultCache.class);
        when(cache.invalidatePrefixes(anyCollection())).thenReturn(3);

        // When
        int removed = CacheInvalidationRules.apply(Mutation.of("todo.add"), cache);

        // Then
        assertEquals(3, removed);
        verify(cache).invalidatePrefixes(anyCollection());
        verify(cache, never()).clear();
    }

    @Test
    @SuppressWarnings("unchecked")
    void apply_UnknownKind_ClearsWholeCache() {
        // Given
        ResultCache<String> cache = mock(ResultCache.class);
        when(cache.size()).thenReturn(5);

        // When
        int removed = CacheInvalidationRules.apply(Mutation.of("heading.add"), cache);

        // Then
        assertEquals(5, removed);
        verify(cache).clear();
    }

    @Test
    void cacheKeys_BuildScopedKeys() {
        assertEquals("todo:ABC", CacheKeys.todo("ABC"));
        assertEquals("todos:project:P1", CacheKeys.todosIn("project:P1"));
        assertEquals("list:today", CacheKeys.list("Today"));
        assertEquals("search:milk", CacheKeys.search("  Milk "));
        assertEquals("recent:7d", CacheKeys.recent("7d"));
        assertThrows(IllegalArgumentException.class, () -> CacheKeys.todo(" "));
    }
}
