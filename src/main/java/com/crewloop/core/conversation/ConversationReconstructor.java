package com.crewloop.core.conversation;

import com.crewloop.core.model.AgentEvent;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds a {@link ConversationContext} from an ordered list of agent events.
 * <p>
 * Understands three generations of event shapes:
 * <ul>
 *   <li>normalized {@code message} events, partial or final</li>
 *   <li>raw streaming {@code content_block_start} / {@code content_block_delta} events</li>
 *   <li>legacy {@code assistant} events carrying a whole turn</li>
 * </ul>
 * plus {@code user_message}, {@code tool_use}, {@code tool_result} and the usage-bearing
 * {@code result}, {@code message_start} and {@code message_delta} events. Anything else is ignored.
 * <p>
 * The transform is pure: the same events always yield the same messages, usage and last prompt.
 * Only {@link ConversationContext#timestamp()} comes from the clock.
 */
public final class ConversationReconstructor {

    private ConversationReconstructor() {}

    public static ConversationContext reconstruct(List<AgentEvent> events) {
        return reconstruct(events, Clock.systemUTC());
    }

    public static ConversationContext reconstruct(List<AgentEvent> events, Clock clock) {
        var state = new State();
        long lastTimestamp = 0;

        for (AgentEvent event : events) {
            String type = event.type();
            if (type == null) {
                continue;
            }
            long ts = event.timestamp();
            lastTimestamp = ts;

            switch (type) {
                case "user_message" -> {
                    state.flush(ts);
                    String content = firstNonEmpty(event.getString("message"), event.getString("content"));
                    if (!content.isEmpty()) {
                        state.messages.add(ConversationMessage.user(content, ts));
                        state.lastPrompt = content;
                    }
                }
                case "message" -> {
                    String content = firstNonEmpty(event.getString("content"));
                    if (event.getBoolean("isPartial")) {
                        state.append(content, ts);
                    } else if (!content.isEmpty()) {
                        state.replace(content, ts);
                    }
                }
                case "content_block_start", "content_block_delta" -> {
                    Map<String, Object> block = event.getMap("content_block");
                    Map<String, Object> delta = event.getMap("delta");
                    if ("text".equals(block.get("type")) || "text_delta".equals(delta.get("type"))) {
                        state.append(firstNonEmpty(asString(block.get("text")), asString(delta.get("text"))), ts);
                    }
                }
                case "assistant" -> {
                    String content = firstNonEmpty(event.getString("content"), event.getString("text"));
                    if (!content.isEmpty()) {
                        state.replace(content, ts);
                    }
                }
                case "tool_use" -> {
                    String id = firstNonEmpty(event.getString("toolUseId"), event.getString("id"));
                    String name = firstNonEmpty(event.getString("tool"), event.getString("name"));
                    if (!id.isEmpty() && !name.isEmpty()) {
                        var input = Collections.unmodifiableMap(new LinkedHashMap<>(event.getMap("input")));
                        state.toolUses.add(new ToolUse(id, name, input, null));
                        state.touch(ts);
                    }
                }
                case "tool_result" -> {
                    String id = firstNonEmpty(event.getString("toolUseId"), event.getString("id"));
                    String output = firstNonEmpty(event.getString("output"), event.getString("result"));
                    String error = event.getString("error");
                    boolean isError = event.getBoolean("isError") || error != null;
                    state.attachResult(id, new ToolResult(output.isEmpty() ? null : output, error, isError));
                }
                case "result" -> {
                    Map<String, Object> usage = event.getMap("usage");
                    state.inputTokens += asLong(usage.get("input_tokens"));
                    state.outputTokens += asLong(usage.get("output_tokens"));
                }
                case "message_start" -> {
                    Map<String, Object> message = event.getMap("message");
                    Object usage = message.get("usage");
                    if (usage instanceof Map<?, ?> m) {
                        state.inputTokens += asLong(m.get("input_tokens"));
                    }
                }
                case "message_delta" -> state.outputTokens += asLong(event.getMap("usage").get("output_tokens"));
                default -> {
                    // not part of the conversation
                }
            }
        }

        state.flush(lastTimestamp);

        return new ConversationContext(
                List.copyOf(state.messages),
                state.lastPrompt,
                TokenUsage.of(state.inputTokens, state.outputTokens),
                clock.millis());
    }

    /** Accumulator for the assistant turn in progress. */
    private static final class State {
        final List<ConversationMessage> messages = new ArrayList<>();
        final List<ToolUse> toolUses = new ArrayList<>();
        final StringBuilder text = new StringBuilder();
        long turnTimestamp;
        String lastPrompt;
        long inputTokens;
        long outputTokens;

        void append(String content, long ts) {
            text.append(content);
            touch(ts);
        }

        void replace(String content, long ts) {
            text.setLength(0);
            text.append(content);
            turnTimestamp = ts;
        }

        void touch(long ts) {
            if (turnTimestamp == 0) {
                turnTimestamp = ts;
            }
        }

        void attachResult(String toolUseId, ToolResult result) {
            for (int i = 0; i < toolUses.size(); i++) {
                if (toolUses.get(i).id().equals(toolUseId)) {
                    toolUses.set(i, toolUses.get(i).withResult(result));
                    return;
                }
            }
        }

        void flush(long fallbackTimestamp) {
            if (text.length() == 0 && toolUses.isEmpty()) {
                return;
            }
            messages.add(new ConversationMessage(
                    ConversationMessage.ASSISTANT,
                    text.toString(),
                    turnTimestamp != 0 ? turnTimestamp : fallbackTimestamp,
                    toolUses.isEmpty() ? null : List.copyOf(toolUses)));
            text.setLength(0);
            toolUses.clear();
            turnTimestamp = 0;
        }
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }

    private static String asString(Object value) {
        return value instanceof String s ? s : null;
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
