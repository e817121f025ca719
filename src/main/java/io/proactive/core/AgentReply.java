package io.proactive.core;

/**
 * Text returned by one agent invocation.
 *
 * @param response the raw response text
 */
public record AgentReply(String response) {

    /** Sentinel an agent answers with when nothing needs the owner's attention. */
    public static final String HEARTBEAT_OK = "HEARTBEAT_OK";

    public AgentReply {
        if (response == null) response = "";
    }

    /** Returns the response without surrounding whitespace. */
    public String trimmed() {
        return response.trim();
    }

    /** True when the agent signalled that no notification is needed. */
    public boolean isHeartbeatOk() {
        return HEARTBEAT_OK.equals(trimmed());
    }
}
