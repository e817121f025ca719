package io.proactive.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;

/**
 * Send-only Telegram channel that posts to the owner's chat through the Bot API.
 *
 * <p>Configure in application.yml:</p>
 * <pre>
 * proactive:
 *   telegram:
 *     enabled: true
 *     token: ${TELEGRAM_BOT_TOKEN}
 *     chat-id: 123456789
 * </pre>
 */
public class TelegramChannel implements Channel {

    private static final Logger log = LoggerFactory.getLogger(TelegramChannel.class);
    public static final String NAME = "telegram";
    static final int MAX_CHUNK = 4000;

    private final String botToken;
    private final long chatId;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public TelegramChannel(String botToken, long chatId, RestClient restClient, ObjectMapper objectMapper) {
        this.botToken = botToken;
        this.chatId = chatId;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void sendMessage(String message) {
        // Telegram has a 4096 char limit per message
        for (String chunk : splitMessage(message, MAX_CHUNK)) {
            String body;
            try {
                body = objectMapper.writeValueAsString(new TelegramSendMessage(chatId, chunk, "Markdown"));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to encode Telegram message", e);
            }
            String response = restClient.post()
                    .uri("/bot{token}/sendMessage", botToken)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
            checkOk(response);
        }
        log.debug("Sent message via Telegram to chat {}", chatId);
    }

    @Override
    public String getName() {
        return NAME;
    }

    private void checkOk(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response == null ? "{}" : response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable Telegram response", e);
        }
        if (!root.path("ok").asBoolean()) {
            throw new IllegalStateException("Telegram API returned not OK: " + root.path("description").asText(""));
        }
    }

    static List<String> splitMessage(String text, int maxLen) {
        if (text.length() <= maxLen) return List.of(text);

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + maxLen, text.length());
            // Try to split on newline
            if (end < text.length()) {
                int lastNewline = text.lastIndexOf('\n', end);
                if (lastNewline > start) end = lastNewline;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        return chunks;
    }

    record TelegramSendMessage(long chat_id, String text, String parse_mode) {}
}
