package io.proactive.channel;

/**
 * A message delivery channel towards the owner (REST inbox, Telegram chat, ...).
 */
public interface Channel {

    /**
     * Sends a message through this channel.
     *
     * @param message the message content to deliver
     * @throws RuntimeException if the channel could not hand the message over
     */
    void sendMessage(String message);

    /**
     * Returns the unique name used to address this channel.
     */
    String getName();
}
