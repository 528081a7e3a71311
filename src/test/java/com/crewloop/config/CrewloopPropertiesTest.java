package com.crewloop.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrewloopPropertiesTest {

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var props = new CrewloopProperties();

        assertEquals(3, props.getWorker().getMaxWorkers());
        assertEquals(Duration.ofSeconds(5), props.getPollingInterval());
        assertEquals(Duration.ofMillis(100), props.getPauseCheckInterval());
        assertEquals(0, props.getWorker().getMaxAttemptsPerTask());
        assertFalse(props.hasTestCommand());
        assertEquals(10, props.getRegistry().getMaxInstances());
        assertEquals(Duration.ofSeconds(5), props.getStopTimeout());
        assertEquals("crewloop-agent", props.getAgent().getCommand());
        assertEquals(List.of("--json"), props.getAgent().getArgs());
        assertEquals("claude", props.getAgent().getName());
        assertEquals("file", props.getPersistence().getProvider());
        assertEquals(Duration.ofHours(1), props.getStaleThreshold());
        assertTrue(props.getPersistence().isEventLog());
        assertEquals("bd", props.getTasks().getCommand());
    }

    @Test
    @DisplayName("workspace path is resolved to an absolute, normalized path")
    void workspacePath() {
        var props = new CrewloopProperties();
        props.getWorkspace().setPath("repo/../repo");

        Path expected = Path.of("repo").toAbsolutePath().normalize();
        assertEquals(expected, props.getWorkspacePath());
    }

    @Test
    @DisplayName("blank test command disables the test hook")
    void testCommand() {
        var props = new CrewloopProperties();
        props.getWorker().setTestCommand("   ");
        assertFalse(props.hasTestCommand());

        props.getWorker().setTestCommand("mvn -q test");
        assertTrue(props.hasTestCommand());
    }
}
