package com.crewloop.core.agent;

import com.crewloop.core.model.AgentEvent;
import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.model.ExitInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProcessAgentControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1_000), ZoneOffset.UTC);

    private FakeProcess process;
    private List<List<String>> launched;
    private RecordingListener listener;
    private ProcessAgentController controller;

    @BeforeEach
    void setUp() {
        process = new FakeProcess();
        launched = new CopyOnWriteArrayList<>();
        listener = new RecordingListener();
        controller = controller(options(Duration.ofSeconds(10)));
    }

    private AgentProcessOptions options(Duration pauseTimeout) {
        return new AgentProcessOptions("crewloop-agent", List.of("--json"), Path.of("/wt"),
                Map.of("A", "1"), null, false, pauseTimeout);
    }

    private ProcessAgentController controller(AgentProcessOptions options) {
        var created = new ProcessAgentController(options, new ObjectMapper(), (command, cwd, env) -> {
            launched.add(command);
            return process;
        }, CLOCK);
        created.addListener(listener);
        return created;
    }

    @Nested
    @DisplayName("command line")
    class CommandLine {

        @Test
        @DisplayName("default agent adds no flags")
        void defaults() {
            assertEquals(List.of("crewloop-agent", "--json"), options(null).commandLine());
        }

        @Test
        @DisplayName("other agents and watch mode add flags")
        void flags() {
            var options = new AgentProcessOptions("crewloop-agent", List.of(), null, null, "codex", true, null);

            assertEquals(List.of("crewloop-agent", "--agent", "codex", "--watch"), options.commandLine());
            assertEquals(AgentProcessOptions.DEFAULT_PAUSE_TIMEOUT, options.pauseTimeout());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("start launches the agent and reports running")
        void start() {
            controller.start();

            assertEquals(List.of(List.of("crewloop-agent", "--json")), launched);
            assertEquals(AgentStatus.RUNNING, controller.status());
            assertEquals(List.of(AgentStatus.STARTING, AgentStatus.RUNNING), listener.statuses);
        }

        @Test
        @DisplayName("a second start is rejected")
        void startTwice() {
            controller.start();

            assertThrows(AgentProcessException.class, () -> controller.start());
        }

        @Test
        @DisplayName("a launch failure reports an error and leaves the agent stopped")
        void launchFailure() {
            var failing = new ProcessAgentController(options(null), new ObjectMapper(), (command, cwd, env) -> {
                throw new IOException("no such file");
            }, CLOCK);
            failing.addListener(listener);

            assertThrows(AgentProcessException.class, failing::start);
            assertEquals(AgentStatus.STOPPED, failing.status());
            assertEquals(1, listener.errors.size());
        }

        @Test
        @DisplayName("stop terminates the process and reports the signal")
        void stop() throws Exception {
            var exit = controller.start();

            controller.stop(Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

            assertEquals(new ExitInfo(143, "SIGTERM"), exit.get(5, TimeUnit.SECONDS));
            assertEquals(AgentStatus.STOPPED, controller.status());
            assertEquals(List.of(new ExitInfo(143, "SIGTERM")), listener.exits);
        }

        @Test
        @DisplayName("stop without a process completes immediately")
        void stopIdle() {
            assertTrue(controller.stop(Duration.ofSeconds(1)).isDone());
        }

        @Test
        @DisplayName("a natural exit carries no signal")
        void naturalExit() throws Exception {
            var exit = controller.start();

            process.exit(0);

            assertEquals(new ExitInfo(0, null), exit.get(5, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("control messages")
    class Control {

        @Test
        @DisplayName("pause waits for the agent to confirm")
        void pauseConfirmed() {
            controller.start();

            controller.pause();
            assertEquals(AgentStatus.PAUSING, controller.status());
            assertEquals("{\"type\":\"pause\"}\n", process.stdinText());

            controller.handleStdoutLine("{\"type\":\"loop_paused\",\"timestamp\":5}");
            assertEquals(AgentStatus.PAUSED, controller.status());
        }

        @Test
        @DisplayName("an unconfirmed pause is assumed after the timeout")
        void pauseAssumed() throws Exception {
            controller = controller(options(Duration.ofMillis(50)));
            controller.start();

            controller.pause();

            long deadline = System.currentTimeMillis() + 5_000;
            while (controller.status() != AgentStatus.PAUSED && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(AgentStatus.PAUSED, controller.status());
        }

        @Test
        @DisplayName("resume requires a paused agent")
        void resume() {
            controller.start();
            assertThrows(AgentProcessException.class, controller::resume);

            controller.pause();
            controller.handleStdoutLine("{\"type\":\"loop_paused\"}");
            controller.resume();

            assertEquals(AgentStatus.RUNNING, controller.status());
            assertTrue(process.stdinText().endsWith("{\"type\":\"resume\"}\n"));
        }

        @Test
        @DisplayName("stop after current sends stop and keeps the process")
        void stopAfterCurrent() {
            controller.start();

            controller.stopAfterCurrent();

            assertEquals(AgentStatus.STOPPING_AFTER_CURRENT, controller.status());
            assertEquals("{\"type\":\"stop\"}\n", process.stdinText());
            assertTrue(process.isAlive());
        }

        @Test
        @DisplayName("control messages need a running agent")
        void requiresProcess() {
            assertThrows(AgentProcessException.class, controller::pause);
            assertThrows(AgentProcessException.class, () -> controller.send("hello"));
        }

        @Test
        @DisplayName("strings are sent verbatim, objects as JSON")
        void send() {
            controller.start();

            controller.send("plain text");
            controller.send(Map.of("type", "user_message"));

            assertEquals("plain text\n{\"type\":\"user_message\"}\n", process.stdinText());
        }
    }

    @Nested
    @DisplayName("output parsing")
    class Parsing {

        @Test
        @DisplayName("JSON lines become events stamped with the receive time when missing")
        void events() {
            controller.handleStdoutLine("  {\"type\":\"message\",\"content\":\"hi\"}  ");
            controller.handleStdoutLine("{\"type\":\"message\",\"timestamp\":42}");

            assertEquals(2, listener.events.size());
            assertEquals(1_000L, listener.events.get(0).timestamp());
            assertEquals("hi", listener.events.get(0).getString("content"));
            assertEquals(42L, listener.events.get(1).timestamp());
        }

        @Test
        @DisplayName("other lines are relayed as output")
        void output() {
            controller.handleStdoutLine("Compiling...");
            controller.handleStdoutLine("{broken json");
            controller.handleStdoutLine("   ");

            assertEquals(List.of("Compiling...", "{broken json"), listener.output);
            assertTrue(listener.events.isEmpty());
        }

        @Test
        @DisplayName("stderr lines are relayed as errors")
        void stderr() {
            controller.handleStderrLine("boom");
            controller.handleStderrLine("");

            assertEquals(1, listener.errors.size());
            assertEquals("stderr: boom", listener.errors.get(0).getMessage());
        }

        @Test
        @DisplayName("a failing listener does not stop delivery to the others")
        void listenerFailure() {
            controller.addListener(new AgentListener() {
                @Override
                public void onOutput(String line) {
                    throw new IllegalStateException("listener bug");
                }
            });
            var second = new RecordingListener();
            controller.addListener(second);

            controller.handleStdoutLine("text");

            assertEquals(List.of("text"), second.output);
        }
    }

    static class RecordingListener implements AgentListener {
        final List<AgentEvent> events = new CopyOnWriteArrayList<>();
        final List<AgentStatus> statuses = new CopyOnWriteArrayList<>();
        final List<String> output = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();
        final List<ExitInfo> exits = new CopyOnWriteArrayList<>();

        @Override
        public void onEvent(AgentEvent event) {
            events.add(event);
        }

        @Override
        public void onStatus(AgentStatus status) {
            statuses.add(status);
        }

        @Override
        public void onOutput(String line) {
            output.add(line);
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }

        @Override
        public void onExit(ExitInfo exit) {
            exits.add(exit);
        }
    }

    /**
     * In-memory process with empty output streams that runs until destroyed or told to exit.
     */
    static class FakeProcess extends Process {

        private final ByteArrayOutputStream stdin = new ByteArrayOutputStream();
        private final CountDownLatch exited = new CountDownLatch(1);
        private volatile int exitCode;

        void exit(int code) {
            if (exited.getCount() > 0) {
                exitCode = code;
                exited.countDown();
            }
        }

        String stdinText() {
            synchronized (stdin) {
                return stdin.toString(StandardCharsets.UTF_8);
            }
        }

        @Override
        public OutputStream getOutputStream() {
            return new OutputStream() {
                @Override
                public void write(int b) {
                    synchronized (stdin) {
                        stdin.write(b);
                    }
                }

                @Override
                public void write(byte[] b, int off, int len) {
                    synchronized (stdin) {
                        stdin.write(b, off, len);
                    }
                }
            };
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public int waitFor() throws InterruptedException {
            exited.await();
            return exitCode;
        }

        @Override
        public int exitValue() {
            if (isAlive()) {
                throw new IllegalThreadStateException("process has not exited");
            }
            return exitCode;
        }

        @Override
        public void destroy() {
            exit(143);
        }

        @Override
        public Process destroyForcibly() {
            exit(137);
            return this;
        }

        @Override
        public boolean isAlive() {
            return exited.getCount() > 0;
        }
    }
}
