package io.proactive.channel;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Exposes the REST inbox so a UI or script can poll for notifications.
 */
@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final ChannelRegistry channelRegistry;

    public NotificationController(ChannelRegistry channelRegistry) {
        this.channelRegistry = channelRegistry;
    }

    /**
     * Returns and clears all buffered notifications.
     */
    @GetMapping
    public ResponseEntity<List<String>> drain() {
        return ResponseEntity.ok(channelRegistry.getRestChannel().drainMessages());
    }
}
