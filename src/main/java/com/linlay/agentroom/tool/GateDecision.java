package com.linlay.agentroom.tool;

/**
 * @param autoExecute         run without asking the operator
 * @param diffPreviewRequired show a {@link FileChangePreview} before asking for confirmation
 */
public record GateDecision(
        boolean autoExecute,
        boolean diffPreviewRequired
) {

    public boolean requiresConfirmation() {
        return !autoExecute;
    }
}
