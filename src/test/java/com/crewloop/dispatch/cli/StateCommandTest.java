package com.crewloop.dispatch.cli;

import com.crewloop.config.CrewloopProperties;
import com.crewloop.core.conversation.ConversationContext;
import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.persistence.EventLogPersister;
import com.crewloop.core.persistence.InMemoryIterationStateStore;
import com.crewloop.core.persistence.IterationState;
import com.crewloop.core.persistence.IterationStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StateCommandTest {

    private InMemoryIterationStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryIterationStateStore();
        store.save(new IterationState("homer-bd-1-1", ConversationContext.empty(1_000L), "s-1",
                AgentStatus.PAUSED, "bd-1", 0L, IterationState.CURRENT_VERSION));
    }

    @Nested
    @DisplayName("show")
    class Show {

        @Test
        @DisplayName("prints a saved iteration")
        void found() {
            var show = new StateCommand.ShowCommand(store, new ObjectMapper());

            assertEquals(0, new CommandLine(show).execute("homer-bd-1-1"));
            assertEquals(0, new CommandLine(show).execute("homer-bd-1-1", "--json"));
        }

        @Test
        @DisplayName("fails for an unknown instance")
        void missing() {
            var show = new StateCommand.ShowCommand(store, new ObjectMapper());

            assertEquals(1, new CommandLine(show).execute("nobody"));
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("removes the checkpoint and the event log")
        void deletes() {
            var eventLog = mock(EventLogPersister.class);
            when(eventLog.clear("homer-bd-1-1")).thenReturn(true);

            int exitCode = new CommandLine(new StateCommand.DeleteCommand(store, eventLog)).execute("homer-bd-1-1");

            assertEquals(0, exitCode);
            assertTrue(store.load("homer-bd-1-1").isEmpty());
            verify(eventLog).clear("homer-bd-1-1");
        }

        @Test
        @DisplayName("fails when nothing was saved")
        void nothingSaved() {
            assertEquals(1, new CommandLine(new StateCommand.DeleteCommand(store, null)).execute("nobody"));
        }
    }

    @Nested
    @DisplayName("cleanup")
    class Cleanup {

        @Test
        @DisplayName("uses the configured threshold by default")
        void configuredThreshold() {
            var mockStore = mock(IterationStateStore.class);
            var properties = new CrewloopProperties();
            properties.getPersistence().setStaleThresholdMinutes(90);

            new CommandLine(new StateCommand.CleanupCommand(mockStore, properties)).execute();

            verify(mockStore).cleanupStale(Duration.ofMinutes(90));
        }

        @Test
        @DisplayName("honours --older-than-minutes")
        void explicitThreshold() {
            var mockStore = mock(IterationStateStore.class);

            new CommandLine(new StateCommand.CleanupCommand(mockStore, new CrewloopProperties()))
                    .execute("--older-than-minutes", "5");

            verify(mockStore).cleanupStale(Duration.ofMinutes(5));
        }
    }

    @Test
    @DisplayName("list prints without failing")
    void list() {
        assertEquals(0, new CommandLine(new StateCommand.ListCommand(store)).execute());
        assertEquals(0, new CommandLine(new StateCommand.ListCommand(new InMemoryIterationStateStore())).execute());
    }
}
