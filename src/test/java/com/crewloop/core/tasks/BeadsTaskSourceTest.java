package com.crewloop.core.tasks;

import com.crewloop.core.model.ReadyTask;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BeadsTaskSourceTest {

    private static final String TWO_READY = """
            [
              {"id": "bd-1", "title": "Add login", "status": "open"},
              {"id": "bd-2", "title": "Fix logout", "status": "open"}
            ]
            """;

    private TestableBeadsTaskSource source;

    @BeforeEach
    void setUp() {
        source = new TestableBeadsTaskSource("homer");
        source.listOutput = TWO_READY;
    }

    @Nested
    @DisplayName("ready tasks")
    class Ready {

        @Test
        @DisplayName("returns the first ready issue")
        void firstReady() {
            assertEquals(Optional.of(new ReadyTask("bd-1", "Add login")), source.getReadyTask());
            assertEquals(List.of("list", "--json", "--ready"), source.commands.get(0));
        }

        @Test
        @DisplayName("empty output means nothing is ready")
        void empty() {
            source.listOutput = "";

            assertTrue(source.getReadyTask().isEmpty());
            assertEquals(0, source.countReadyTasks());
        }

        @Test
        @DisplayName("entries without an id are skipped")
        void skipsMissingIds() {
            source.listOutput = "[{\"title\": \"orphan\"}, {\"id\": \"bd-3\"}]";

            assertEquals(Optional.of(new ReadyTask("bd-3", "")), source.getReadyTask());
            assertEquals(1, source.countReadyTasks());
        }

        @Test
        @DisplayName("unreadable output is a task source failure")
        void unreadable() {
            source.listOutput = "{not json";

            assertThrows(TaskSourceException.class, () -> source.getReadyTask());
        }

        @Test
        @DisplayName("claimed issues are hidden until closed")
        void hidesClaimed() {
            source.claimTask("bd-1");

            assertEquals("bd-2", source.getReadyTask().orElseThrow().id());
            assertEquals(1, source.countReadyTasks());

            source.closeTask("bd-1");

            assertEquals(2, source.countReadyTasks());
        }
    }

    @Nested
    @DisplayName("claim")
    class Claim {

        @Test
        @DisplayName("marks the issue in progress and assigns it")
        void claims() {
            source.claimTask("bd-1");

            assertEquals(List.of("update", "--json", "bd-1", "--status", "in_progress", "--assignee", "homer"),
                    source.commands.get(0));
        }

        @Test
        @DisplayName("omits the assignee when none is configured")
        void noAssignee() {
            var unassigned = new TestableBeadsTaskSource(null);

            unassigned.claimTask("bd-1");

            assertEquals(List.of("update", "--json", "bd-1", "--status", "in_progress"), unassigned.commands.get(0));
        }

        @Test
        @DisplayName("a second claim of the same issue fails without calling the tracker")
        void duplicate() {
            source.claimTask("bd-1");

            assertThrows(TaskSourceException.class, () -> source.claimTask("bd-1"));
            assertEquals(1, source.commands.size());
        }

        @Test
        @DisplayName("a failed claim can be retried")
        void rollback() {
            source.failing = "update";

            assertThrows(TaskSourceException.class, () -> source.claimTask("bd-1"));

            source.failing = null;
            assertDoesNotThrow(() -> source.claimTask("bd-1"));
        }
    }

    @Test
    @DisplayName("close runs bd close")
    void close() {
        source.closeTask("bd-2");

        assertEquals(List.of("close", "--json", "bd-2"), source.commands.get(0));
    }

    /**
     * Test subclass that records tracker invocations instead of running {@code bd}.
     */
    static class TestableBeadsTaskSource extends BeadsTaskSource {

        final List<List<String>> commands = new ArrayList<>();
        String listOutput = "[]";
        String failing;

        TestableBeadsTaskSource(String assignee) {
            super("bd", Path.of("/work"), assignee, new ObjectMapper());
        }

        @Override
        String runBd(String... args) {
            commands.add(List.of(args));
            if (args[0].equals(failing)) {
                throw new TaskSourceException("bd " + args[0] + " failed with code 1");
            }
            return args[0].equals("list") ? listOutput : "{}";
        }
    }
}
