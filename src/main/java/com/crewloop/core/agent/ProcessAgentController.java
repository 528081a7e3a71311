package com.crewloop.core.agent;

import com.crewloop.core.model.AgentEvent;
import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.model.ExitInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link AgentProcessController} for agents that speak newline-delimited JSON.
 *
 * <p>Protocol:
 * <ul>
 *   <li>every stdout line that parses as a JSON object is an {@link AgentEvent}; events without a
 *       timestamp get the receive time; other lines are relayed as output</li>
 *   <li>every stderr line is relayed as an error</li>
 *   <li>control messages {@code {"type":"pause"}}, {@code {"type":"resume"}} and
 *       {@code {"type":"stop"}} go to stdin</li>
 *   <li>{@code loop_paused} / {@code loop_resumed} events from the agent confirm pause and resume</li>
 * </ul>
 *
 * <p>If a pause is not confirmed within the configured timeout the controller assumes it.
 */
public class ProcessAgentController implements AgentProcessController {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentController.class);

    private static final ScheduledExecutorService TIMERS = Executors.newSingleThreadScheduledExecutor(r -> {
        var thread = new Thread(r, "agent-timers");
        thread.setDaemon(true);
        return thread;
    });

    private final AgentProcessOptions options;
    private final ObjectMapper objectMapper;
    private final ProcessLauncher launcher;
    private final Clock clock;
    private final List<AgentListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private Process process;
    private OutputStream stdin;
    private AgentStatus status = AgentStatus.STOPPED;
    private ScheduledFuture<?> pauseWatchdog;
    private String stopSignal;
    private CompletableFuture<ExitInfo> exitFuture = CompletableFuture.completedFuture(new ExitInfo(0, null));

    public ProcessAgentController(AgentProcessOptions options, ObjectMapper objectMapper) {
        this(options, objectMapper, ProcessLauncher.SYSTEM, Clock.systemUTC());
    }

    public ProcessAgentController(AgentProcessOptions options, ObjectMapper objectMapper,
                                  ProcessLauncher launcher, Clock clock) {
        this.options = options;
        this.objectMapper = objectMapper;
        this.launcher = launcher;
        this.clock = clock;
    }

    public AgentProcessOptions getOptions() {
        return options;
    }

    @Override
    public CompletableFuture<ExitInfo> start() {
        Process started;
        CompletableFuture<ExitInfo> future;
        synchronized (lock) {
            if (process != null) {
                throw new AgentProcessException("Agent is already running");
            }
            setStatus(AgentStatus.STARTING);
            List<String> command = options.commandLine();
            try {
                started = launcher.launch(command, options.cwd(), options.env());
            } catch (IOException | RuntimeException e) {
                setStatus(AgentStatus.STOPPED);
                var failure = new AgentProcessException("Failed to start agent: " + String.join(" ", command), e);
                fire(l -> l.onError(failure));
                throw failure;
            }
            process = started;
            stdin = started.getOutputStream();
            stopSignal = null;
            future = new CompletableFuture<>();
            exitFuture = future;
            log.info("Started agent '{}' in {}", String.join(" ", command), options.cwd());
            setStatus(AgentStatus.RUNNING);
        }

        Thread stdoutReader = startReader("stdout", started.getInputStream(), this::handleStdoutLine);
        Thread stderrReader = startReader("stderr", started.getErrorStream(), this::handleStderrLine);
        var watcher = new Thread(() -> awaitExit(started, stdoutReader, stderrReader, future), "agent-exit-watcher");
        watcher.setDaemon(true);
        watcher.start();
        return future;
    }

    @Override
    public void pause() {
        synchronized (lock) {
            requireProcess();
            if (status == AgentStatus.PAUSED || status == AgentStatus.PAUSING) {
                return;
            }
            if (status != AgentStatus.RUNNING) {
                throw new AgentProcessException("Cannot pause agent in " + status.wireValue() + " state");
            }
            send(Map.of("type", "pause"));
            setStatus(AgentStatus.PAUSING);
            pauseWatchdog = TIMERS.schedule(this::pauseTimedOut,
                    options.pauseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void resume() {
        synchronized (lock) {
            requireProcess();
            if (status != AgentStatus.PAUSED) {
                throw new AgentProcessException("Cannot resume agent in " + status.wireValue() + " state");
            }
            cancelPauseWatchdog();
            send(Map.of("type", "resume"));
            setStatus(AgentStatus.RUNNING);
        }
    }

    @Override
    public void stopAfterCurrent() {
        synchronized (lock) {
            requireProcess();
            if (status != AgentStatus.RUNNING && status != AgentStatus.PAUSED) {
                throw new AgentProcessException("Cannot stop-after-current agent in " + status.wireValue() + " state");
            }
            send(Map.of("type", "stop"));
            setStatus(AgentStatus.STOPPING_AFTER_CURRENT);
        }
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        Process target;
        CompletableFuture<ExitInfo> future;
        synchronized (lock) {
            if (process == null) {
                return CompletableFuture.completedFuture(null);
            }
            target = process;
            future = exitFuture;
            cancelPauseWatchdog();
            setStatus(AgentStatus.STOPPING);
            stopSignal = "SIGTERM";
        }

        target.destroy();
        ScheduledFuture<?> forceKill = TIMERS.schedule(() -> {
            if (target.isAlive()) {
                log.warn("Agent did not exit within {} ms, killing it", timeout.toMillis());
                synchronized (lock) {
                    stopSignal = "SIGKILL";
                }
                target.destroyForcibly();
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        return future.handle((exit, error) -> {
            forceKill.cancel(false);
            return null;
        });
    }

    @Override
    public void send(Object payload) {
        String line;
        if (payload instanceof String s) {
            line = s;
        } else {
            try {
                line = objectMapper.writeValueAsString(payload);
            } catch (JsonProcessingException e) {
                throw new AgentProcessException("Cannot serialize message for agent", e);
            }
        }
        synchronized (lock) {
            if (process == null || stdin == null) {
                throw new AgentProcessException("Agent is not running or stdin is not writable");
            }
            try {
                stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            } catch (IOException e) {
                throw new AgentProcessException("Agent is not running or stdin is not writable", e);
            }
        }
    }

    @Override
    public AgentStatus status() {
        synchronized (lock) {
            return status;
        }
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

    // -- stdout / stderr handling ---------------------------------------------

    void handleStdoutLine(String raw) {
        String line = raw.trim();
        if (line.isEmpty()) {
            return;
        }
        AgentEvent event = parseEvent(line);
        if (event == null) {
            fire(l -> l.onOutput(line));
            return;
        }
        if (!event.hasTimestamp()) {
            event = event.with("timestamp", clock.millis());
        }

        if (AgentEvent.LOOP_PAUSED.equals(event.type())) {
            synchronized (lock) {
                cancelPauseWatchdog();
                setStatus(AgentStatus.PAUSED);
            }
        } else if (AgentEvent.LOOP_RESUMED.equals(event.type())) {
            synchronized (lock) {
                setStatus(AgentStatus.RUNNING);
            }
        }

        AgentEvent delivered = event;
        fire(l -> l.onEvent(delivered));
    }

    void handleStderrLine(String raw) {
        String message = raw.trim();
        if (!message.isEmpty()) {
            var error = new AgentProcessException("stderr: " + message);
            fire(l -> l.onError(error));
        }
    }

    @SuppressWarnings("unchecked")
    private AgentEvent parseEvent(String line) {
        if (!line.startsWith("{")) {
            return null;
        }
        try {
            Map<String, Object> fields = objectMapper.readValue(line, Map.class);
            return fields == null ? null : new AgentEvent(fields);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private Thread startReader(String name, InputStream stream, Consumer<String> handler) {
        var thread = new Thread(() -> {
            try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    handler.accept(line);
                }
            } catch (IOException e) {
                log.debug("Agent {} closed: {}", name, e.getMessage());
            }
        }, "agent-" + name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void awaitExit(Process target, Thread stdoutReader, Thread stderrReader,
                           CompletableFuture<ExitInfo> future) {
        int code;
        try {
            code = target.waitFor();
            stdoutReader.join(TimeUnit.SECONDS.toMillis(5));
            stderrReader.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.completeExceptionally(e);
            return;
        }

        ExitInfo exit;
        synchronized (lock) {
            exit = new ExitInfo(code, stopSignal);
            process = null;
            stdin = null;
            cancelPauseWatchdog();
            setStatus(AgentStatus.STOPPED);
        }
        log.info("Agent exited with code {}{}", code, exit.signal() != null ? " (" + exit.signal() + ")" : "");
        fire(l -> l.onExit(exit));
        future.complete(exit);
    }

    // -- status ---------------------------------------------------------------

    private void pauseTimedOut() {
        synchronized (lock) {
            if (status == AgentStatus.PAUSING) {
                log.warn("Agent did not confirm pause within {} ms, assuming paused", options.pauseTimeout().toMillis());
                setStatus(AgentStatus.PAUSED);
            }
        }
    }

    private void cancelPauseWatchdog() {
        if (pauseWatchdog != null) {
            pauseWatchdog.cancel(false);
            pauseWatchdog = null;
        }
    }

    private void requireProcess() {
        if (process == null) {
            throw new AgentProcessException("Agent is not running");
        }
    }

    /** Caller holds {@link #lock}. */
    private void setStatus(AgentStatus next) {
        if (status != next) {
            status = next;
            fire(l -> l.onStatus(next));
        }
    }

    private void fire(Consumer<AgentListener> notification) {
        for (AgentListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.warn("Agent listener threw: {}", e.getMessage(), e);
            }
        }
    }
}
