package com.crewloop.core.worker;

/**
 * @param exitCode  process exit code, non-zero on failure
 * @param sessionId agent session id if the agent reported one, may be null
 */
public record AgentRunResult(int exitCode, String sessionId) {}
