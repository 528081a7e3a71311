package com.crewloop.core.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Map;

/**
 * A tool invocation made by the assistant, with its result once one has been seen.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolUse(
    String id,
    String name,
    Map<String, Object> input,
    ToolResult result
) implements Serializable {

    public ToolUse withResult(ToolResult result) {
        return new ToolUse(id, name, input, result);
    }
}
