package io.proactive.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Delivers notifications to the owner's channel.
 *
 * <p>The owner channel is looked up by name in the {@link ChannelRegistry} and cached once
 * found. Until it is registered, deliveries are skipped with a warning.</p>
 */
public class OwnerDeliveryPort implements DeliveryPort {

    private static final Logger log = LoggerFactory.getLogger(OwnerDeliveryPort.class);

    private final ChannelRegistry channelRegistry;
    private final String ownerChannelName;
    private final AtomicReference<Channel> ownerChannel = new AtomicReference<>();

    public OwnerDeliveryPort(ChannelRegistry channelRegistry, String ownerChannelName) {
        this.channelRegistry = channelRegistry;
        this.ownerChannelName = ownerChannelName;
    }

    @Override
    public boolean deliver(String message) {
        Optional<Channel> target = resolveOwner();
        if (target.isEmpty()) {
            log.warn("Owner channel '{}' not registered yet - skipping delivery", ownerChannelName);
            return false;
        }
        try {
            target.get().sendMessage(message);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to deliver message to owner via '{}'", ownerChannelName, e);
            return false;
        }
    }

    private Optional<Channel> resolveOwner() {
        Channel cached = ownerChannel.get();
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Channel> found = channelRegistry.getChannel(ownerChannelName);
        found.ifPresent(channel -> {
            if (ownerChannel.compareAndSet(null, channel)) {
                log.info("Owner channel resolved: {}", channel.getName());
            }
        });
        return found;
    }
}
