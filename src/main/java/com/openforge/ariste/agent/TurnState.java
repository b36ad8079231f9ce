package com.openforge.ariste.agent;

/**
 * States of one top-level turn. AWAITING_MODEL is initial; DONE and FAILED are terminal.
 */
public enum TurnState {
    AWAITING_MODEL,
    DISPATCHING_TOOLS,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
