package com.mouse.scanner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.scanner.interfaces.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API channel ({@code sendMessage}, HTML parse mode).
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitoring.alerts.telegram.enabled", havingValue = "true")
public class TelegramNotificationChannel implements NotificationChannel {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    // Telegram rejects longer texts
    private static final int MAX_MESSAGE_LENGTH = 4096;

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    @Value("${monitoring.alerts.telegram.api-url:https://api.telegram.org}")
    private String apiUrl;

    @Value("${monitoring.alerts.telegram.bot-token}")
    private String botToken;

    @Value("${monitoring.alerts.telegram.chat-id}")
    private String chatId;

    @Override
    public String getName() {
        return "telegram";
    }

    @Override
    public boolean send(String formattedText) {
        try {
            String text = formattedText.length() > MAX_MESSAGE_LENGTH
                    ? formattedText.substring(0, MAX_MESSAGE_LENGTH - 3) + "..."
                    : formattedText;

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("chat_id", chatId);
            payload.put("text", text);
            payload.put("parse_mode", "HTML");
            payload.put("disable_web_page_preview", true);

            Request request = new Request.Builder()
                    .url(apiUrl + "/bot" + botToken + "/sendMessage")
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();

            try (Response response = okHttpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    log.error("Telegram sendMessage failed with HTTP {}", response.code());
                    return false;
                }
                return true;
            }
        } catch (Exception e) {
            log.error("Failed to send Telegram alert", e);
            return false;
        }
    }
}
