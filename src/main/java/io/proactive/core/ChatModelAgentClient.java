package io.proactive.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;

/**
 * {@link AgentClient} backed by a Spring AI {@link ChatModel}.
 * Every call sends a single user message, so no session state leaks between jobs.
 */
public class ChatModelAgentClient implements AgentClient {

    private static final Logger log = LoggerFactory.getLogger(ChatModelAgentClient.class);

    private final ChatModel chatModel;

    public ChatModelAgentClient(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public AgentReply send(String prompt) {
        log.debug("Sending prompt to agent: {}...", prompt.substring(0, Math.min(100, prompt.length())));
        String response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException e) {
            throw new AgentException("Agent invocation failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new AgentException("Agent returned no response");
        }
        return new AgentReply(response);
    }
}
