package com.crewloop.dispatch.cli;

import com.crewloop.config.CrewloopProperties;
import com.crewloop.core.conversation.ConversationMessage;
import com.crewloop.core.persistence.EventLogPersister;
import com.crewloop.core.persistence.IterationState;
import com.crewloop.core.persistence.IterationStateStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: crewloop state list|show|delete|cleanup
 * <p>
 * Inspects and prunes the saved iteration checkpoints of agent instances.
 */
@Command(name = "state", mixinStandardHelpOptions = true, description = "Inspect saved iteration state",
        subcommands = {
                StateCommand.ListCommand.class,
                StateCommand.ShowCommand.class,
                StateCommand.DeleteCommand.class,
                StateCommand.CleanupCommand.class
        })
@Component
public class StateCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "List saved iterations")
    @Component
    public static class ListCommand implements Runnable {

        private final IterationStateStore stateStore;

        public ListCommand(IterationStateStore stateStore) {
            this.stateStore = stateStore;
        }

        @Override
        public void run() {
            ConsoleOutput.printBanner();

            List<IterationState> states = stateStore.getAll();
            if (states.isEmpty()) {
                ConsoleOutput.info("No saved iterations.");
                return;
            }

            ConsoleOutput.info("Saved iterations (" + states.size() + "):");
            System.out.println();
            System.out.printf("  %-28s %-24s %-10s %-9s %s%n", "INSTANCE ID", "STATUS", "TASK", "MESSAGES", "SAVED");
            System.out.println("  " + "-".repeat(90));
            long now = System.currentTimeMillis();
            for (IterationState state : states) {
                System.out.printf("  %-28s %-24s %-10s %-9d %s ago%n",
                        ConsoleOutput.truncate(state.instanceId(), 28),
                        state.status() != null ? state.status().wireValue() : "-",
                        ConsoleOutput.truncate(state.currentTaskId(), 10),
                        state.conversationContext().messages().size(),
                        ConsoleOutput.formatDuration(Math.max(0, now - state.savedAt())));
            }
        }
    }

    @Command(name = "show", mixinStandardHelpOptions = true, description = "Show a saved iteration")
    @Component
    public static class ShowCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Instance ID")
        private String instanceId;

        @Option(names = "--json", description = "Print the raw checkpoint")
        private boolean json;

        private final IterationStateStore stateStore;
        private final ObjectMapper objectMapper;

        public ShowCommand(IterationStateStore stateStore, ObjectMapper objectMapper) {
            this.stateStore = stateStore;
            this.objectMapper = objectMapper;
        }

        @Override
        public Integer call() throws JsonProcessingException {
            var found = stateStore.load(instanceId);
            if (found.isEmpty()) {
                ConsoleOutput.error("No saved iteration for " + instanceId);
                return 1;
            }
            IterationState state = found.get();

            if (json) {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state));
                return 0;
            }

            ConsoleOutput.printBanner();
            var context = state.conversationContext();
            System.out.println("Instance:  " + state.instanceId());
            System.out.println("Status:    " + (state.status() != null ? state.status().wireValue() : "-"));
            System.out.println("Task:      " + (state.currentTaskId() != null ? state.currentTaskId() : "-"));
            System.out.println("Session:   " + (state.sessionId() != null ? state.sessionId() : "-"));
            System.out.println("Saved at:  " + Instant.ofEpochMilli(state.savedAt()));
            System.out.println("Tokens:    " + context.usage().inputTokens() + " in, " + context.usage().outputTokens() + " out");
            System.out.println("Last ask:  " + ConsoleOutput.truncate(context.lastPrompt(), 70));
            System.out.println();

            for (ConversationMessage message : context.messages()) {
                String role = ConversationMessage.USER.equals(message.role())
                        ? "@|fg(cyan) USER     |@" : "@|fg(green) ASSISTANT|@";
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  " + role + " " + ConsoleOutput.truncate(message.content(), 80)));
                if (message.toolUses() == null) {
                    continue;
                }
                for (var toolUse : message.toolUses()) {
                    String outcome = toolUse.result() == null ? "pending"
                            : toolUse.result().isError() ? "error" : "ok";
                    System.out.println("             tool " + toolUse.name() + " (" + outcome + ")");
                }
            }
            return 0;
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a saved iteration")
    @Component
    public static class DeleteCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Instance ID")
        private String instanceId;

        private final IterationStateStore stateStore;
        private final EventLogPersister eventLog;

        public DeleteCommand(IterationStateStore stateStore,
                             @Autowired(required = false) EventLogPersister eventLog) {
            this.stateStore = stateStore;
            this.eventLog = eventLog;
        }

        @Override
        public Integer call() {
            boolean deleted = stateStore.delete(instanceId);
            boolean logCleared = eventLog != null && eventLog.clear(instanceId);
            if (!deleted && !logCleared) {
                ConsoleOutput.error("Nothing saved for " + instanceId);
                return 1;
            }
            ConsoleOutput.success("Deleted saved state of " + instanceId);
            return 0;
        }
    }

    @Command(name = "cleanup", mixinStandardHelpOptions = true, description = "Delete stale saved iterations")
    @Component
    public static class CleanupCommand implements Runnable {

        @Option(names = "--older-than-minutes",
                description = "Age threshold (default: crewloop.persistence.stale-threshold-minutes)")
        private Integer olderThanMinutes;

        private final IterationStateStore stateStore;
        private final CrewloopProperties properties;

        public CleanupCommand(IterationStateStore stateStore, CrewloopProperties properties) {
            this.stateStore = stateStore;
            this.properties = properties;
        }

        @Override
        public void run() {
            Duration threshold = olderThanMinutes != null
                    ? Duration.ofMinutes(olderThanMinutes)
                    : properties.getStaleThreshold();
            int removed = stateStore.cleanupStale(threshold);
            ConsoleOutput.success("Removed " + removed + " iteration" + (removed != 1 ? "s" : "")
                    + " older than " + threshold.toMinutes() + " minutes");
        }
    }
}
