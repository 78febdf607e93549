package com.linlay.agentroom.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * @param args attributes other than {@code name}, in declaration order
 * @param body trimmed text between the tags
 */
public record ToolCall(
        String name,
        Map<String, String> args,
        String body
) {

    public ToolCall {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        body = body == null ? "" : body;
    }
}
