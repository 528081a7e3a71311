package com.crewloop.core.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.List;

/**
 * Resumable snapshot of a conversation, always derived from an instance's event history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationContext(
    List<ConversationMessage> messages,
    String lastPrompt,
    TokenUsage usage,
    long timestamp
) implements Serializable {

    public static ConversationContext empty(long timestamp) {
        return new ConversationContext(List.of(), null, TokenUsage.EMPTY, timestamp);
    }
}
