package com.crewloop.core.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
    String output,
    String error,
    @JsonProperty("isError") boolean isError
) implements Serializable {}
