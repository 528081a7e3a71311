package com.crewloop.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "crewloop")
public class CrewloopProperties {

    private Workspace workspace = new Workspace();
    private Worker worker = new Worker();
    private Registry registry = new Registry();
    private Agent agent = new Agent();
    private Persistence persistence = new Persistence();
    private Tasks tasks = new Tasks();

    // -- Derived accessors --
    public Path getWorkspacePath() { return Path.of(workspace.path).toAbsolutePath().normalize(); }
    public Duration getPollingInterval() { return Duration.ofMillis(worker.pollingIntervalMs); }
    public Duration getPauseCheckInterval() { return Duration.ofMillis(worker.pauseCheckIntervalMs); }
    public Duration getStopTimeout() { return Duration.ofSeconds(registry.stopTimeoutSeconds); }
    public Duration getStaleThreshold() { return Duration.ofMinutes(persistence.staleThresholdMinutes); }

    /**
     * Returns true when a post-merge test command is configured.
     */
    public boolean hasTestCommand() {
        return worker.testCommand != null && !worker.testCommand.isBlank();
    }

    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }
    public Tasks getTasks() { return tasks; }
    public void setTasks(Tasks tasks) { this.tasks = tasks; }

    public static class Workspace {
        private String path = ".";
        private String mainBranch = "";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getMainBranch() { return mainBranch; }
        public void setMainBranch(String mainBranch) { this.mainBranch = mainBranch; }
    }

    public static class Worker {
        private int maxWorkers = 3;
        private long pollingIntervalMs = 5000;
        private long pauseCheckIntervalMs = 100;
        private int maxAttemptsPerTask = 0;
        private String testCommand = "";

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }
        public long getPollingIntervalMs() { return pollingIntervalMs; }
        public void setPollingIntervalMs(long pollingIntervalMs) { this.pollingIntervalMs = pollingIntervalMs; }
        public long getPauseCheckIntervalMs() { return pauseCheckIntervalMs; }
        public void setPauseCheckIntervalMs(long pauseCheckIntervalMs) { this.pauseCheckIntervalMs = pauseCheckIntervalMs; }
        public int getMaxAttemptsPerTask() { return maxAttemptsPerTask; }
        public void setMaxAttemptsPerTask(int maxAttemptsPerTask) { this.maxAttemptsPerTask = maxAttemptsPerTask; }
        public String getTestCommand() { return testCommand; }
        public void setTestCommand(String testCommand) { this.testCommand = testCommand; }
    }

    public static class Registry {
        private int maxInstances = 10;
        private int stopTimeoutSeconds = 5;

        public int getMaxInstances() { return maxInstances; }
        public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }
        public int getStopTimeoutSeconds() { return stopTimeoutSeconds; }
        public void setStopTimeoutSeconds(int stopTimeoutSeconds) { this.stopTimeoutSeconds = stopTimeoutSeconds; }
    }

    public static class Agent {
        private String command = "crewloop-agent";
        private List<String> args = new ArrayList<>(List.of("--json"));
        private String name = "claude";
        private Map<String, String> env = new LinkedHashMap<>();

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
    }

    public static class Persistence {
        private String provider = "file";
        private int staleThresholdMinutes = 60;
        private boolean eventLog = true;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public int getStaleThresholdMinutes() { return staleThresholdMinutes; }
        public void setStaleThresholdMinutes(int staleThresholdMinutes) { this.staleThresholdMinutes = staleThresholdMinutes; }
        public boolean isEventLog() { return eventLog; }
        public void setEventLog(boolean eventLog) { this.eventLog = eventLog; }
    }

    public static class Tasks {
        private String command = "bd";
        private String assignee = "";

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getAssignee() { return assignee; }
        public void setAssignee(String assignee) { this.assignee = assignee; }
    }
}
