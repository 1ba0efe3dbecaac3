package com.ryuqq.scriptgate.core.contract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScriptCommand 테스트.
 *
 * @author ScriptGate Team
 * @since 1.0.0
 */
class ScriptCommandTest {

    @Test
    void read_WithCacheKey_IsCacheable() {
        // When
        ScriptCommand command = ScriptCommand.read("get_todos", "return 1", "todos:all");

        // Then
        assertTrue(command.isRead());
        assertTrue(command.isCacheable());
    }

    @Test
    void read_WithSideEffects_IsNotCacheable() {
        ScriptCommand command = ScriptCommand.read("get_todos", "return 1", "todos:all").withSideEffects(true);

        assertFalse(command.isCacheable());
    }

    @Test
    void read_WithoutCacheKey_IsNotCacheable() {
        assertFalse(ScriptCommand.read("ping", "return 1").isCacheable());
    }

    @Test
    void write_IsNeverCacheable() {
        ScriptCommand command = ScriptCommand.write("add_todo", "make new to do", Mutation.of("todo.add"));

        assertTrue(command.isWrite());
        assertFalse(command.isCacheable());
    }

    @Test
    void idempotentHint_DefaultsByAccessMode() {
        ScriptCommand read = ScriptCommand.read("get_todos", "return 1", "todos:all");
        ScriptCommand write = ScriptCommand.write("add_todo", "make new to do", Mutation.of("todo.add"));

        assertTrue(read.idempotent());
        assertFalse(write.idempotent());
        assertTrue(write.withIdempotent(true).idempotent());
        assertEquals(write.mutation(), write.withIdempotent(true).mutation());
    }

    @Test
    void write_WithoutMutation_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ScriptCommand.write("add_todo", "make new to do", null)
        );
        assertTrue(exception.getMessage().contains("requires a mutation"));
    }

    @Test
    void write_WithCacheKey_ThrowsException() {
        ScriptCommand command = ScriptCommand.write("add_todo", "make new to do", Mutation.of("todo.add"));

        assertThrows(IllegalArgumentException.class, () -> command.withCacheKey("todos:all"));
    }

    @Test
    void constructor_BlankScript_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ScriptCommand.read("ping", " "));
    }

    @Test
    void toString_DoesNotExposeScript() {
        ScriptCommand command = ScriptCommand.read("get_todo", "return \"secret note\"", "todo:1");

        assertFalse(command.toString().contains("secret note"));
        assertTrue(command.toString().contains("get_todo"));
    }

    @Test
    void mutation_NormalizesKindAndBlankScopes() {
        Mutation mutation = Mutation.of(" Todo.Update ", "ABC", " ");

        assertEquals("todo.update", mutation.kind());
        assertEquals("todo", mutation.entity());
        assertNull(mutation.parentScope());
    }

    @Test
    void resultShape_AcceptsMatchingOutput() {
        assertTrue(ResultShape.ANY.accepts(""));
        assertFalse(ResultShape.TEXT.accepts("  "));
        assertTrue(ResultShape.IDENTIFIER.accepts("ABC123\n"));
        assertFalse(ResultShape.IDENTIFIER.accepts("two words"));
        assertTrue(ResultShape.BOOLEAN.accepts("true"));
        assertFalse(ResultShape.BOOLEAN.accepts("yes"));
        assertTrue(ResultShape.INTEGER.accepts("-12"));
        assertTrue(ResultShape.DATE_FIELDS.accepts("year:2025 month:1 day:15 time:0"));
        assertFalse(ResultShape.DATE_FIELDS.accepts("Wednesday, 15 January 2025"));
    }
}
