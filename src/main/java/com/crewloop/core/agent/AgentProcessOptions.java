package com.crewloop.core.agent;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * How to launch an agent process.
 *
 * @param command      executable
 * @param args         base arguments
 * @param cwd          working directory
 * @param env          extra environment variables
 * @param agent        agent flavour; anything other than {@code "claude"} adds {@code --agent <name>}
 * @param watch        adds {@code --watch}
 * @param pauseTimeout how long to wait for the agent to confirm a pause before assuming it
 */
public record AgentProcessOptions(
    String command,
    List<String> args,
    Path cwd,
    Map<String, String> env,
    String agent,
    boolean watch,
    Duration pauseTimeout
) {
    public static final String DEFAULT_AGENT = "claude";
    public static final Duration DEFAULT_PAUSE_TIMEOUT = Duration.ofSeconds(10);

    public AgentProcessOptions {
        args = args == null ? List.of() : List.copyOf(args);
        env = env == null ? Map.of() : Map.copyOf(env);
        agent = agent == null || agent.isBlank() ? DEFAULT_AGENT : agent;
        pauseTimeout = pauseTimeout == null ? DEFAULT_PAUSE_TIMEOUT : pauseTimeout;
    }

    public AgentProcessOptions withCwd(Path cwd) {
        return new AgentProcessOptions(command, args, cwd, env, agent, watch, pauseTimeout);
    }

    public AgentProcessOptions withAgent(String agent) {
        return new AgentProcessOptions(command, args, cwd, env, agent, watch, pauseTimeout);
    }

    /**
     * Full command line: executable, base args, then the flags derived from the options.
     */
    public List<String> commandLine() {
        var line = new ArrayList<String>();
        line.add(command);
        line.addAll(args);
        if (!DEFAULT_AGENT.equals(agent)) {
            line.add("--agent");
            line.add(agent);
        }
        if (watch) {
            line.add("--watch");
        }
        return line;
    }
}
