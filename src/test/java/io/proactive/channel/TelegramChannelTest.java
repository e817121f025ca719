package io.proactive.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class TelegramChannelTest {

    private MockRestServiceServer server;
    private TelegramChannel channel;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.telegram.org");
        server = MockRestServiceServer.bindTo(builder).build();
        channel = new TelegramChannel("TOKEN", 42L, builder.build(), new ObjectMapper());
    }

    @Test
    void shouldPostMessageToOwnerChat() {
        server.expect(requestTo("https://api.telegram.org/botTOKEN/sendMessage"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.chat_id").value(42))
                .andExpect(jsonPath("$.text").value("Hello"))
                .andExpect(jsonPath("$.parse_mode").value("Markdown"))
                .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

        channel.sendMessage("Hello");

        server.verify();
        assertEquals("telegram", channel.getName());
    }

    @Test
    void shouldFailWhenApiRejectsMessage() {
        server.expect(requestTo("https://api.telegram.org/botTOKEN/sendMessage"))
                .andRespond(withSuccess("{\"ok\":false,\"description\":\"chat not found\"}", MediaType.APPLICATION_JSON));

        var e = assertThrows(IllegalStateException.class, () -> channel.sendMessage("Hello"));
        assertTrue(e.getMessage().contains("chat not found"));
    }

    @Test
    void shouldSendLongMessagesInChunks() {
        server.expect(requestTo("https://api.telegram.org/botTOKEN/sendMessage"))
                .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://api.telegram.org/botTOKEN/sendMessage"))
                .andRespond(withSuccess("{\"ok\":true}", MediaType.APPLICATION_JSON));

        channel.sendMessage("x".repeat(TelegramChannel.MAX_CHUNK + 10));

        server.verify();
    }

    @Test
    void shouldKeepShortMessageWhole() {
        assertEquals(List.of("short"), TelegramChannel.splitMessage("short", 10));
    }

    @Test
    void shouldSplitOnNewlineWhenPossible() {
        List<String> chunks = TelegramChannel.splitMessage("aaaa\nbbbb\ncccc", 8);

        assertEquals(List.of("aaaa", "\nbbbb", "\ncccc"), chunks);
        assertEquals("aaaa\nbbbb\ncccc", String.join("", chunks));
    }

    @Test
    void shouldHardSplitWithoutNewlines() {
        assertEquals(List.of("abc", "def", "g"), TelegramChannel.splitMessage("abcdefg", 3));
    }
}
