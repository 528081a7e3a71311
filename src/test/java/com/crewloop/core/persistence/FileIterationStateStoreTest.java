package com.crewloop.core.persistence;

import com.crewloop.core.conversation.ConversationContext;
import com.crewloop.core.conversation.ConversationMessage;
import com.crewloop.core.conversation.TokenUsage;
import com.crewloop.core.conversation.ToolResult;
import com.crewloop.core.conversation.ToolUse;
import com.crewloop.core.model.AgentStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileIterationStateStoreTest {

    private static final long NOW = 10_000_000L;

    @TempDir
    Path workspace;

    private MutableClock clock;
    private ObjectMapper objectMapper;
    private FileIterationStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        objectMapper = new ObjectMapper();
        store = new FileIterationStateStore(workspace, objectMapper, clock);
    }

    private static IterationState state(String id) {
        var toolUse = new ToolUse("t1", "bash", Map.of("cmd", "ls"), new ToolResult("a.txt", null, false));
        var context = new ConversationContext(
                List.of(ConversationMessage.user("Hi", 1),
                        new ConversationMessage(ConversationMessage.ASSISTANT, "Hello", 2, List.of(toolUse))),
                "Hi", TokenUsage.of(10, 5), 3);
        return new IterationState(id, context, "s-1", AgentStatus.RUNNING, "T-1", 0, IterationState.CURRENT_VERSION);
    }

    @Nested
    @DisplayName("save and load")
    class SaveAndLoad {

        @Test
        @DisplayName("stores one JSON file per instance under .crewloop/iterations")
        void writesFile() {
            store.save(state("a"));

            Path file = workspace.resolve(".crewloop/iterations/a.json");
            assertTrue(Files.exists(file));
            assertEquals(file.getParent(), store.getStoreDir());
            assertTrue(store.has("a"));
        }

        @Test
        @DisplayName("loads what was saved, stamped with the save time")
        void loadsSaved() {
            store.save(state("a"));

            var loaded = store.load("a").orElseThrow();

            assertEquals(NOW, loaded.savedAt());
            assertEquals(state("a").stamped(NOW), loaded);
            assertTrue(loaded.conversationContext().messages().get(1).toolUses().get(0).result() != null);
        }

        @Test
        @DisplayName("missing instances load as empty")
        void missing() {
            assertTrue(store.load("nope").isEmpty());
        }

        @Test
        @DisplayName("corrupt files load as empty")
        void corrupt() throws Exception {
            Files.createDirectories(store.getStoreDir());
            Files.writeString(store.getStoreDir().resolve("bad.json"), "{not json");

            assertTrue(store.load("bad").isEmpty());
        }

        @Test
        @DisplayName("files with another version load as empty")
        void wrongVersion() throws Exception {
            store.save(state("a"));
            Path file = store.getStoreDir().resolve("a.json");
            Files.writeString(file, Files.readString(file).replace("\"version\" : 1", "\"version\" : 99"));

            assertTrue(store.load("a").isEmpty());
        }

        @Test
        @DisplayName("saving again replaces the previous checkpoint")
        void overwrites() {
            store.save(state("a"));
            clock.advance(Duration.ofMinutes(1));
            var next = new IterationState("a", ConversationContext.empty(5), null, AgentStatus.PAUSED, null, 0,
                    IterationState.CURRENT_VERSION);
            store.save(next);

            var loaded = store.load("a").orElseThrow();
            assertEquals(AgentStatus.PAUSED, loaded.status());
            assertTrue(loaded.conversationContext().messages().isEmpty());
            assertEquals(1, store.count());
        }
    }

    @Nested
    @DisplayName("housekeeping")
    class Housekeeping {

        @Test
        @DisplayName("lists ids in order")
        void listsIds() {
            store.save(state("b"));
            store.save(state("a"));

            assertEquals(List.of("a", "b"), store.getAllInstanceIds());
            assertEquals(2, store.getAll().size());
        }

        @Test
        @DisplayName("delete reports whether anything was removed")
        void delete() {
            store.save(state("a"));

            assertTrue(store.delete("a"));
            assertFalse(store.delete("a"));
            assertFalse(store.has("a"));
        }

        @Test
        @DisplayName("cleanupStale removes only states older than the threshold")
        void cleanupStale() {
            store.save(state("old"));
            clock.advance(Duration.ofMinutes(90));
            store.save(state("fresh"));

            int removed = store.cleanupStale(IterationStateStore.DEFAULT_STALE_THRESHOLD);

            assertEquals(1, removed);
            assertEquals(List.of("fresh"), store.getAllInstanceIds());
        }

        @Test
        @DisplayName("clear removes everything")
        void clear() {
            store.save(state("a"));
            store.save(state("b"));

            store.clear();

            assertEquals(0, store.count());
        }

        @Test
        @DisplayName("an empty workspace has no states")
        void emptyWorkspace() {
            assertTrue(store.getAllInstanceIds().isEmpty());
            assertEquals(0, store.cleanupStale(Duration.ZERO));
        }
    }

    /** Clock the test can move forward. */
    static final class MutableClock extends Clock {
        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(Duration duration) {
            millis += duration.toMillis();
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
