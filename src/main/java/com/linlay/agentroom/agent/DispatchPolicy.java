package com.linlay.agentroom.agent;

/**
 * How many agents answer a message that mentions several of them.
 */
public enum DispatchPolicy {
    /** Every valid mention, in order of first appearance. */
    ALL_MENTIONS,
    /** Only the first valid mention; later mentions stay in the text. */
    FIRST_MENTION
}
