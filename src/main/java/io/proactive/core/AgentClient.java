package io.proactive.core;

/**
 * Stateless access to the natural-language agent.
 * Each call is a fresh turn with no conversational state carried over.
 */
public interface AgentClient {

    /**
     * Sends a prompt and waits for the agent's answer.
     *
     * @param prompt the full instruction text
     * @return the agent's reply
     * @throws AgentException if the invocation fails
     */
    AgentReply send(String prompt);
}
