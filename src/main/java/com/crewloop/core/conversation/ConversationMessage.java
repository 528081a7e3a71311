package com.crewloop.core.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.List;

/**
 * One turn of the conversation.
 *
 * @param role      {@code "user"} or {@code "assistant"}
 * @param content   prompt or assistant text
 * @param timestamp epoch millis of the turn
 * @param toolUses  tool invocations of an assistant turn, null when there were none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationMessage(
    String role,
    String content,
    long timestamp,
    List<ToolUse> toolUses
) implements Serializable {

    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    public static ConversationMessage user(String content, long timestamp) {
        return new ConversationMessage(USER, content, timestamp, null);
    }
}
