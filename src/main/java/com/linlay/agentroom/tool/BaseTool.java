package com.linlay.agentroom.tool;

import java.util.Map;

public interface BaseTool {

    String name();

    default String description() {
        return "";
    }

    /**
     * Argument filled from the tag body when the call does not set it as an attribute.
     */
    String primaryArgument();

    /**
     * Runs the tool. Failures are reported in the returned text.
     */
    String invoke(Map<String, String> args);
}
