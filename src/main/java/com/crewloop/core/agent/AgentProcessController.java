package com.crewloop.core.agent;

import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.model.ExitInfo;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Owns one external agent process: spawns it, relays its output as events and
 * forwards control messages to it.
 */
public interface AgentProcessController {

    /**
     * Spawns the agent process.
     *
     * @return a future completed with the exit details once the process has ended and
     *         all of its output has been delivered
     * @throws AgentProcessException if a process is already running or could not be spawned
     */
    CompletableFuture<ExitInfo> start();

    /**
     * Asks the agent to pause after its current session.
     */
    void pause();

    void resume();

    /**
     * Asks the agent to stop once its current session is done.
     */
    void stopAfterCurrent();

    /**
     * Terminates the process, forcibly once {@code timeout} has elapsed.
     *
     * @return a future completed when the process has exited
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Writes a message to the agent's stdin as one JSON line.
     *
     * @param payload a pre-serialized string or an object to serialize
     */
    void send(Object payload);

    AgentStatus status();

    default boolean isRunning() {
        return status() == AgentStatus.RUNNING;
    }

    default boolean canAcceptMessages() {
        return status().acceptsMessages();
    }

    void addListener(AgentListener listener);

    void removeListener(AgentListener listener);

    void removeAllListeners();
}
