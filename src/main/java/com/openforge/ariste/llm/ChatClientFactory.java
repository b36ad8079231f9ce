package com.openforge.ariste.llm;

/**
 * Builds chat clients. The single seam through which agents obtain a client,
 * which lets the orchestrator decide per subagent whether tool definitions
 * are attached at all.
 */
@FunctionalInterface
public interface ChatClientFactory {

    ChatClient create(ChatOptions options);
}
