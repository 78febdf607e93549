package com.linlay.agentroom.service;

/**
 * Asks the operator whether an untrusted agent's tool call may run. May block.
 */
@FunctionalInterface
public interface ConfirmationHandler {

    ConfirmationHandler DEFER_ALL = request -> ConfirmationDecision.DEFERRED;

    ConfirmationDecision confirm(ToolConfirmationRequest request);
}
