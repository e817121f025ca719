package io.proactive.channel;

/**
 * Sends notifications to the human owner. Best-effort: never throws.
 */
public interface DeliveryPort {

    /**
     * Delivers a message to the owner.
     *
     * @param message the notification text
     * @return true if the message was handed to a channel, false if no target is
     *         configured yet or the channel failed
     */
    boolean deliver(String message);
}
