package com.openforge.ariste.agent.subagent;

public enum SubAgentStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
