package com.crewloop.core.persistence;

import com.crewloop.core.conversation.ConversationContext;
import com.crewloop.core.model.AgentStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * Checkpoint of an instance's resumable state, keyed by instance id.
 *
 * @param instanceId          owning instance
 * @param conversationContext conversation rebuilt from the instance's event history
 * @param sessionId           agent session id for resumption, may be null
 * @param status              controller status at save time
 * @param currentTaskId       task in progress, may be null
 * @param savedAt             epoch millis of the save
 * @param version             format version, always {@link #CURRENT_VERSION}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IterationState(
    String instanceId,
    ConversationContext conversationContext,
    String sessionId,
    AgentStatus status,
    String currentTaskId,
    long savedAt,
    int version
) implements Serializable {

    public static final int CURRENT_VERSION = 1;

    public IterationState stamped(long savedAt) {
        return new IterationState(instanceId, conversationContext, sessionId, status,
                currentTaskId, savedAt, CURRENT_VERSION);
    }
}
