package io.proactive.channel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OwnerDeliveryPortTest {

    private ChannelRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ChannelRegistry();
    }

    @Test
    void shouldDeliverToRestInboxByDefault() {
        var port = new OwnerDeliveryPort(registry, RestChannel.NAME);

        assertTrue(port.deliver("Hello"));
        assertEquals(List.of("Hello"), registry.getRestChannel().drainMessages());
    }

    @Test
    void shouldSkipUntilOwnerChannelIsRegistered() {
        var port = new OwnerDeliveryPort(registry, "telegram");
        assertFalse(port.deliver("too early"));

        var telegram = new ChannelRegistryTest.TestChannel("telegram");
        registry.register(telegram);

        assertTrue(port.deliver("now"));
        assertEquals(List.of("now"), telegram.messages());
        assertTrue(registry.getRestChannel().drainMessages().isEmpty());
    }

    @Test
    void shouldReturnFalseWhenChannelFails() {
        Channel broken = mock(Channel.class);
        when(broken.getName()).thenReturn("telegram");
        doThrow(new IllegalStateException("Telegram API returned not OK")).when(broken).sendMessage(anyString());
        registry.register(broken);
        var port = new OwnerDeliveryPort(registry, "telegram");

        assertFalse(port.deliver("Hello"));
        verify(broken).sendMessage("Hello");
    }
}
