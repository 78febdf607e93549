package com.linlay.agentroom.service;

public enum ConfirmationDecision {
    APPROVED,
    DECLINED,
    /** No answer yet; the call is reported as pending. */
    DEFERRED
}
