package io.proactive.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of delivery channels by name. The REST inbox is always present.
 *
 * <p>Thread-safe: channels can be registered/unregistered from any thread.</p>
 */
public class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final RestChannel restChannel = new RestChannel();

    public ChannelRegistry() {
        register(restChannel);
    }

    public void register(Channel channel) {
        channels.put(channel.getName(), channel);
        log.info("Channel registered: {}", channel.getName());
    }

    public void unregister(String name) {
        if (RestChannel.NAME.equals(name)) {
            throw new IllegalArgumentException("The REST channel cannot be unregistered");
        }
        channels.remove(name);
        log.info("Channel unregistered: {}", name);
    }

    public Optional<Channel> getChannel(String name) {
        return Optional.ofNullable(channels.get(name));
    }

    public List<String> listChannels() {
        return List.copyOf(channels.keySet());
    }

    public RestChannel getRestChannel() {
        return restChannel;
    }
}
