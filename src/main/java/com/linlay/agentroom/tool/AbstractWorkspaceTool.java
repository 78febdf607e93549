package com.linlay.agentroom.tool;

import com.linlay.agentroom.security.PathValidator;

import java.util.Map;

public abstract class AbstractWorkspaceTool implements BaseTool {

    protected final PathValidator pathValidator;

    protected AbstractWorkspaceTool(PathValidator pathValidator) {
        this.pathValidator = pathValidator;
    }

    protected String argument(Map<String, String> args, String key) {
        if (args == null) {
            return "";
        }
        String value = args.get(key);
        return value == null ? "" : value.trim();
    }
}
