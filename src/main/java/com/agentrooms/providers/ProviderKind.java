package com.agentrooms.providers;

public enum ProviderKind {
    LOCAL_TOOL,
    REMOTE_HTTP,
    LLM_API
}
