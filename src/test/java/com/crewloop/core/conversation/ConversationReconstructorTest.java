package com.crewloop.core.conversation;

import com.crewloop.core.model.AgentEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConversationReconstructorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(99_000), ZoneOffset.UTC);

    private static AgentEvent event(String type, long ts, Map<String, Object> fields) {
        return AgentEvent.of(type, ts, fields);
    }

    private static ConversationContext reconstruct(AgentEvent... events) {
        return ConversationReconstructor.reconstruct(List.of(events), CLOCK);
    }

    @Test
    @DisplayName("empty event list yields an empty context stamped with the clock")
    void emptyEvents() {
        var context = reconstruct();

        assertTrue(context.messages().isEmpty());
        assertNull(context.lastPrompt());
        assertEquals(TokenUsage.EMPTY, context.usage());
        assertEquals(99_000, context.timestamp());
    }

    @Nested
    @DisplayName("message events")
    class MessageEvents {

        @Test
        @DisplayName("user prompt followed by partial assistant chunks")
        void userThenPartials() {
            var context = reconstruct(
                    event("user_message", 1, Map.of("message", "Hi")),
                    event("message", 2, Map.of("content", "Hel", "isPartial", true)),
                    event("message", 3, Map.of("content", "lo", "isPartial", true)),
                    event("result", 4, Map.of("usage", Map.of("input_tokens", 10, "output_tokens", 5))));

            assertEquals(2, context.messages().size());
            assertEquals(new ConversationMessage("user", "Hi", 1, null), context.messages().get(0));
            assertEquals(new ConversationMessage("assistant", "Hello", 2, null), context.messages().get(1));
            assertEquals("Hi", context.lastPrompt());
            assertEquals(new TokenUsage(10, 5, 15), context.usage());
        }

        @Test
        @DisplayName("final message replaces accumulated partial text")
        void finalReplacesPartials() {
            var context = reconstruct(
                    event("message", 1, Map.of("content", "dra", "isPartial", true)),
                    event("message", 2, Map.of("content", "Final answer")));

            assertEquals(1, context.messages().size());
            assertEquals("Final answer", context.messages().get(0).content());
        }

        @Test
        @DisplayName("empty final message keeps the partial text")
        void emptyFinalKeepsPartials() {
            var context = reconstruct(
                    event("message", 1, Map.of("content", "kept", "isPartial", true)),
                    event("message", 2, Map.of("content", "")));

            assertEquals("kept", context.messages().get(0).content());
        }

        @Test
        @DisplayName("a new user prompt flushes the assistant turn in progress")
        void userPromptFlushesTurn() {
            var context = reconstruct(
                    event("user_message", 1, Map.of("content", "first")),
                    event("assistant", 2, Map.of("text", "answer one")),
                    event("user_message", 3, Map.of("message", "second")),
                    event("assistant", 4, Map.of("content", "answer two")));

            assertEquals(List.of("first", "answer one", "second", "answer two"),
                    context.messages().stream().map(ConversationMessage::content).toList());
            assertEquals("second", context.lastPrompt());
        }

        @Test
        @DisplayName("empty user prompt adds no message")
        void emptyUserPrompt() {
            var context = reconstruct(event("user_message", 1, Map.of("message", "")));

            assertTrue(context.messages().isEmpty());
            assertNull(context.lastPrompt());
        }
    }

    @Nested
    @DisplayName("streaming content blocks")
    class StreamingEvents {

        @Test
        @DisplayName("text blocks and deltas are concatenated")
        void concatenatesBlocks() {
            var context = reconstruct(
                    event("message_start", 1, Map.of("message", Map.of("usage", Map.of("input_tokens", 7)))),
                    event("content_block_start", 2, Map.of("content_block", Map.of("type", "text", "text", "A"))),
                    event("content_block_delta", 3, Map.of("delta", Map.of("type", "text_delta", "text", "B"))),
                    event("content_block_delta", 4, Map.of("delta", Map.of("type", "input_json_delta", "partial_json", "{"))),
                    event("message_delta", 5, Map.of("usage", Map.of("output_tokens", 3))),
                    event("message_stop", 6, Map.of()));

            assertEquals(1, context.messages().size());
            assertEquals("AB", context.messages().get(0).content());
            assertEquals(2, context.messages().get(0).timestamp());
            assertEquals(new TokenUsage(7, 3, 10), context.usage());
        }
    }

    @Nested
    @DisplayName("tool calls")
    class ToolEvents {

        @Test
        @DisplayName("tool result is attached to its tool use")
        void attachesResult() {
            var context = reconstruct(
                    event("tool_use", 1, Map.of("toolUseId", "t1", "tool", "bash", "input", Map.of("cmd", "ls"))),
                    event("tool_result", 2, Map.of("toolUseId", "t1", "output", "a.txt")));

            assertEquals(1, context.messages().size());
            var message = context.messages().get(0);
            assertEquals("assistant", message.role());
            assertEquals("", message.content());
            assertEquals(1, message.timestamp());
            assertEquals(1, message.toolUses().size());

            var toolUse = message.toolUses().get(0);
            assertEquals("t1", toolUse.id());
            assertEquals("bash", toolUse.name());
            assertEquals(Map.of("cmd", "ls"), toolUse.input());
            assertEquals(new ToolResult("a.txt", null, false), toolUse.result());
        }

        @Test
        @DisplayName("an error on the result marks it as failed")
        void errorResult() {
            var context = reconstruct(
                    event("tool_use", 1, Map.of("id", "t1", "name", "edit")),
                    event("tool_result", 2, Map.of("id", "t1", "error", "denied")));

            var result = context.messages().get(0).toolUses().get(0).result();
            assertNull(result.output());
            assertEquals("denied", result.error());
            assertTrue(result.isError());
        }

        @Test
        @DisplayName("result for an unknown tool use is dropped")
        void unknownToolUseIgnored() {
            var context = reconstruct(
                    event("tool_use", 1, Map.of("id", "t1", "name", "edit")),
                    event("tool_result", 2, Map.of("id", "other", "output", "x")));

            assertNull(context.messages().get(0).toolUses().get(0).result());
        }

        @Test
        @DisplayName("tool use without a name is ignored")
        void toolUseWithoutName() {
            var context = reconstruct(event("tool_use", 1, Map.of("id", "t1")));

            assertTrue(context.messages().isEmpty());
        }
    }

    @Test
    @DisplayName("unknown event types are ignored")
    void ignoresUnknownTypes() {
        var context = reconstruct(
                event("task_started", 1, Map.of("taskId", "T-1")),
                event("status", 2, Map.of("status", "running")));

        assertTrue(context.messages().isEmpty());
        assertEquals(TokenUsage.EMPTY, context.usage());
    }

    @Test
    @DisplayName("same events always produce the same messages")
    void deterministic() {
        var events = List.of(
                event("user_message", 1, Map.of("message", "go")),
                event("message", 2, Map.of("content", "done")),
                event("result", 3, Map.of("usage", Map.of("input_tokens", 1, "output_tokens", 2))));

        var first = ConversationReconstructor.reconstruct(events, CLOCK);
        var second = ConversationReconstructor.reconstruct(events, CLOCK);

        assertEquals(first, second);
    }
}
