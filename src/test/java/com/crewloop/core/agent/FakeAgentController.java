package com.crewloop.core.agent;

import com.crewloop.core.model.AgentEvent;
import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.model.ExitInfo;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory controller for tests: the test drives events, status changes and exit by hand.
 */
public class FakeAgentController implements AgentProcessController {

    private final List<AgentListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Object> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger stopCalls = new AtomicInteger();
    private volatile AgentStatus status = AgentStatus.STOPPED;
    private volatile CompletableFuture<ExitInfo> exitFuture = new CompletableFuture<>();

    @Override
    public CompletableFuture<ExitInfo> start() {
        exitFuture = new CompletableFuture<>();
        setStatus(AgentStatus.RUNNING);
        return exitFuture;
    }

    @Override
    public void pause() {
        setStatus(AgentStatus.PAUSED);
    }

    @Override
    public void resume() {
        setStatus(AgentStatus.RUNNING);
    }

    @Override
    public void stopAfterCurrent() {
        setStatus(AgentStatus.STOPPING_AFTER_CURRENT);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        stopCalls.incrementAndGet();
        if (status != AgentStatus.STOPPED) {
            exit(new ExitInfo(null, "SIGTERM"));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void send(Object payload) {
        sent.add(payload);
    }

    @Override
    public AgentStatus status() {
        return status;
    }

    @Override
    public void addListener(AgentListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(AgentListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void removeAllListeners() {
        listeners.clear();
    }

    // -- test hooks --

    public void emit(AgentEvent event) {
        listeners.forEach(l -> l.onEvent(event));
    }

    public void emitError(Throwable error) {
        listeners.forEach(l -> l.onError(error));
    }

    public void setStatus(AgentStatus next) {
        status = next;
        listeners.forEach(l -> l.onStatus(next));
    }

    public void exit(ExitInfo exit) {
        status = AgentStatus.STOPPED;
        listeners.forEach(l -> l.onExit(exit));
        exitFuture.complete(exit);
    }

    public int stopCalls() {
        return stopCalls.get();
    }

    public int listenerCount() {
        return listeners.size();
    }

    public List<Object> sent() {
        return sent;
    }
}
