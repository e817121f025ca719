package io.proactive.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * REST inbox channel. Buffers notifications until they are drained via
 * {@code GET /api/notifications}.
 */
public class RestChannel implements Channel {

    private static final Logger log = LoggerFactory.getLogger(RestChannel.class);
    public static final String NAME = "rest";

    private final ConcurrentLinkedQueue<String> pendingMessages = new ConcurrentLinkedQueue<>();

    @Override
    public void sendMessage(String message) {
        log.debug("REST channel buffering message: {}...", message.substring(0, Math.min(50, message.length())));
        pendingMessages.add(message);
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Drains all pending messages, oldest first.
     */
    public List<String> drainMessages() {
        var messages = new ArrayList<String>();
        String msg;
        while ((msg = pendingMessages.poll()) != null) {
            messages.add(msg);
        }
        return messages;
    }

    public boolean hasPendingMessages() {
        return !pendingMessages.isEmpty();
    }
}
