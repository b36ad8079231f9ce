package com.openforge.ariste.agent;

import com.openforge.ariste.agent.subagent.SubAgentTask;

/**
 * Target of the delegation tool. Returns the text that becomes the tool message.
 */
@FunctionalInterface
public interface Delegator {

    String delegate(SubAgentTask task, DispatchContext parent);
}
