package com.agentrooms.shared.error;

public enum ErrorKind {
    /** Rejected before any stream opens. */
    VALIDATION,
    AUTHENTICATION,
    BACKEND,
    TIMEOUT,
    /** Surfaces as an aborted event, never as an error. */
    CANCELLED
}
