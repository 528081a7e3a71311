package com.crewloop.core.conversation;

import java.io.Serializable;

/**
 * Token counts accumulated over a conversation. {@code totalTokens} is always the sum of the other two.
 */
public record TokenUsage(
    long inputTokens,
    long outputTokens,
    long totalTokens
) implements Serializable {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0, 0);

    public static TokenUsage of(long inputTokens, long outputTokens) {
        return new TokenUsage(inputTokens, outputTokens, inputTokens + outputTokens);
    }
}
