package com.linlay.agentroom.tool;

import com.linlay.agentroom.trust.TrustLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a parsed tool call runs on its own or needs the operator, and runs it.
 * <p>
 * Execution never throws: unknown tools and tool failures come back as {@code Error: ...} text so a
 * turn does not abort because a tool failed.
 */
@Component
public class ToolGate {

    private static final Logger log = LoggerFactory.getLogger(ToolGate.class);

    private final ToolRegistry toolRegistry;
    private final TrustLedger trustLedger;

    public ToolGate(ToolRegistry toolRegistry, TrustLedger trustLedger) {
        this.toolRegistry = toolRegistry;
        this.trustLedger = trustLedger;
    }

    public GateDecision decide(String agentName, String toolName) {
        if (trustLedger.isTrusted(agentName)) {
            return new GateDecision(true, false);
        }
        boolean mutatesFiles = toolRegistry.find(toolName)
                .map(tool -> tool instanceof FileMutatingTool)
                .orElse(false);
        return new GateDecision(false, mutatesFiles);
    }

    /**
     * Attributes plus the body under the tool's primary argument when the attributes lack it.
     */
    public Map<String, String> resolveArguments(ToolCall call) {
        Map<String, String> args = new LinkedHashMap<>(call.args());
        toolRegistry.find(call.name()).ifPresent(tool -> {
            String primary = tool.primaryArgument();
            if (primary != null && !args.containsKey(primary) && !call.body().isEmpty()) {
                args.put(primary, call.body());
            }
        });
        return args;
    }

    public Optional<FileChangePreview> preview(ToolCall call) {
        Optional<BaseTool> tool = toolRegistry.find(call.name());
        if (tool.isEmpty() || !(tool.get() instanceof FileMutatingTool mutatingTool)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mutatingTool.preview(resolveArguments(call)));
        } catch (RuntimeException ex) {
            log.warn("Cannot preview tool call '{}': {}", call.name(), ex.getMessage());
            return Optional.empty();
        }
    }

    public String execute(ToolCall call) {
        Optional<BaseTool> tool = toolRegistry.find(call.name());
        if (tool.isEmpty()) {
            return "Error: Tool '" + call.name() + "' not found.";
        }
        try {
            String result = tool.get().invoke(resolveArguments(call));
            return result == null ? "" : result;
        } catch (RuntimeException ex) {
            log.warn("Tool '{}' failed", call.name(), ex);
            String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return "Error: " + message;
        }
    }
}
