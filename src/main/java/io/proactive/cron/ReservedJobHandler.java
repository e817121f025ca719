package io.proactive.cron;

import io.proactive.core.AgentReply;

import java.util.Optional;

/**
 * Takes over prompt building and delivery filtering for a ledger job with a reserved name.
 * The stored prompt of such a job is ignored; the handler builds a fresh one on every run.
 */
public interface ReservedJobHandler {

    String jobName();

    /**
     * Builds the prompt for this run.
     *
     * @return empty to skip the run without calling the agent
     */
    Optional<String> preparePrompt();

    /**
     * Whether the agent's reply should reach the owner. Accepted replies are delivered as-is.
     */
    boolean shouldDeliver(AgentReply reply);
}
