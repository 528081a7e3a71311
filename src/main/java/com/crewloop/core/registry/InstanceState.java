package com.crewloop.core.registry;

import com.crewloop.core.agent.AgentProcessController;
import com.crewloop.core.model.AgentStatus;
import com.crewloop.core.model.MergeConflict;

import java.nio.file.Path;

/**
 * One supervised agent instance. Mutable fields are written only by {@link InstanceRegistry}.
 */
public final class InstanceState {

    private final String id;
    private final String name;
    private final String agentName;
    private final Path worktreePath;
    private final String branch;
    private final AgentProcessController controller;
    private final long createdAt;
    private final long sequence;

    private volatile CurrentTask currentTask = new CurrentTask(null, null);
    private volatile MergeConflict mergeConflict;

    InstanceState(CreateInstanceOptions options, AgentProcessController controller, long createdAt, long sequence) {
        this.id = options.id();
        this.name = options.name();
        this.agentName = options.agentName();
        this.worktreePath = options.worktreePath();
        this.branch = options.branch();
        this.controller = controller;
        this.createdAt = createdAt;
        this.sequence = sequence;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getAgentName() { return agentName; }
    public Path getWorktreePath() { return worktreePath; }
    public String getBranch() { return branch; }
    public AgentProcessController getController() { return controller; }
    public long getCreatedAt() { return createdAt; }
    public String getCurrentTaskId() { return currentTask.taskId(); }
    public String getCurrentTaskTitle() { return currentTask.taskTitle(); }
    public MergeConflict getMergeConflict() { return mergeConflict; }

    public AgentStatus getStatus() {
        return controller.status();
    }

    long getSequence() { return sequence; }
    CurrentTask currentTask() { return currentTask; }
    void setCurrentTask(CurrentTask currentTask) { this.currentTask = currentTask; }
    void setMergeConflict(MergeConflict mergeConflict) { this.mergeConflict = mergeConflict; }
}
