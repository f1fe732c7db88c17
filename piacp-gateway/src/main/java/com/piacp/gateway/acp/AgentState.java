package com.piacp.gateway.acp;

/**
 * Per-connection bridge lifecycle. {@code SESSION_ACTIVE} and
 * {@code PROMPTING} alternate while a session is open.
 */
public enum AgentState {
    UNINITIALIZED,
    INITIALIZED,
    SESSION_ACTIVE,
    PROMPTING,
    CLOSED
}
