package com.crewloop.core.model;

/**
 * How an agent process ended.
 *
 * @param code   exit code, or null when the process was killed by a signal
 * @param signal signal name, or null on a normal exit
 */
public record ExitInfo(Integer code, String signal) {}
