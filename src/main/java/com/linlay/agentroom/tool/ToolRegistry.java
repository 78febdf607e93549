package com.linlay.agentroom.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Tools available to agents, keyed by lower-cased name. Every tool is added by an explicit
 * {@link #register(BaseTool)} call.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, BaseTool> toolsByName = new ConcurrentSkipListMap<>();

    public ToolRegistry() {
    }

    public ToolRegistry(List<BaseTool> tools) {
        tools.forEach(this::register);
    }

    public void register(BaseTool tool) {
        String name = normalizeName(tool.name());
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        BaseTool previous = toolsByName.put(name, tool);
        if (previous != null) {
            log.warn("Tool '{}' registered twice, keeping the latest", name);
        } else {
            log.debug("Registered tool '{}' (primary argument '{}')", name, tool.primaryArgument());
        }
    }

    public Optional<BaseTool> find(String toolName) {
        return Optional.ofNullable(toolsByName.get(normalizeName(toolName)));
    }

    public List<BaseTool> list() {
        return List.copyOf(toolsByName.values());
    }

    /**
     * Tool listing appended to agent system prompts.
     */
    public String describeTools() {
        if (toolsByName.isEmpty()) {
            return "";
        }
        StringBuilder info = new StringBuilder(
                "Available Tools (call them using <tool_call name=\"tool_name\">argument</tool_call>):\n");
        for (BaseTool tool : toolsByName.values()) {
            info.append("- ").append(tool.name()).append(": ").append(tool.description()).append('\n');
        }
        return info.toString();
    }

    private String normalizeName(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
