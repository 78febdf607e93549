package com.linlay.agentroom.provider;

/**
 * @param usage provider-reported token accounting, {@code null} when the backend reports none
 */
public record CompletionResult(
        String content,
        String modelName,
        ProviderTokenUsage usage
) {

    public CompletionResult {
        content = content == null ? "" : content;
    }
}
