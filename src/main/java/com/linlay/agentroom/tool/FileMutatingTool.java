package com.linlay.agentroom.tool;

import java.util.Map;

/**
 * A tool that changes files. Unless the agent is trusted, its calls are previewed as a diff before
 * confirmation.
 */
public interface FileMutatingTool extends BaseTool {

    FileChangePreview preview(Map<String, String> args);
}
