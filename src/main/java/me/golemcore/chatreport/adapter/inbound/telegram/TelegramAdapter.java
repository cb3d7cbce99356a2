package me.golemcore.chatreport.adapter.inbound.telegram;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.exception.DeliveryException;
import me.golemcore.chatreport.domain.exception.DuplicateMessageException;
import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.domain.service.ChatDirectory;
import me.golemcore.chatreport.domain.service.MessageStore;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import me.golemcore.chatreport.port.inbound.ChannelPort;
import me.golemcore.chatreport.port.inbound.CommandPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Telegram channel adapter using long polling.
 *
 * <p>
 * Inbound, it stores every text message posted in an enabled group chat and
 * routes slash commands to the {@link CommandPort}. Outbound, it sends HTML
 * messages and reports transport failures as {@link DeliveryException}:
 * <ul>
 * <li>429 is retryable and carries Telegram's {@code retry_after}
 * <li>5xx and network errors are retryable
 * <li>other 4xx (chat not found, bot kicked, bad markup) are permanent
 * </ul>
 * Retrying is left to the caller.
 */
@Component
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_SERVER_ERROR = 500;

    private final BotProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageStore messageStore;
    private final ChatDirectory chatDirectory;
    private final ObjectProvider<CommandPort> commandRouter;
    private final Clock clock;

    private TelegramClient telegramClient;
    private volatile boolean running = false;
    private volatile boolean initialized = false;
    private final Object lifecycleLock = new Object();

    public TelegramAdapter(BotProperties properties, TelegramBotsLongPollingApplication botsApplication,
            MessageStore messageStore, ChatDirectory chatDirectory, ObjectProvider<CommandPort> commandRouter,
            Clock clock) {
        this.properties = properties;
        this.botsApplication = botsApplication;
        this.messageStore = messageStore;
        this.chatDirectory = chatDirectory;
        this.commandRouter = commandRouter;
        this.clock = clock;
    }

    /**
     * Package-private setter for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
        this.initialized = true;
    }

    private boolean isEnabled() {
        return properties.getTelegram().isEnabled();
    }

    private synchronized void ensureInitialized() {
        if (initialized || !isEnabled()) {
            return;
        }
        String token = properties.getTelegram().getToken();
        if (token == null || token.isBlank()) {
            log.warn("[Telegram] Token not configured, adapter will not start");
            return;
        }
        this.telegramClient = new OkHttpTelegramClient(token);
        initialized = true;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            ensureInitialized();
            if (telegramClient == null) {
                log.warn("[Telegram] Client not initialized, cannot start");
                return;
            }

            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) { // NOSONAR - close() declares Exception
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage() && update.getMessage().hasText()) {
            handleMessage(update.getMessage());
        }
    }

    private void handleMessage(org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage) {
        long chatId = telegramMessage.getChatId();
        String text = telegramMessage.getText();
        User from = telegramMessage.getFrom();

        if (text.startsWith("/")) {
            handleCommand(telegramMessage, text);
            return;
        }

        if (!chatDirectory.isEnabled(chatId)) {
            log.trace("[Telegram] Ignoring message from unmonitored chat {}", chatId);
            return;
        }

        Message message = Message.builder()
                .chatId(chatId)
                .messageId(telegramMessage.getMessageId())
                .senderId(from != null ? from.getId() : 0L)
                .senderName(displayName(from))
                .text(text)
                .sentAt(telegramMessage.getDate() != null
                        ? Instant.ofEpochSecond(telegramMessage.getDate())
                        : clock.instant())
                .createdAt(clock.instant())
                .build();

        try {
            messageStore.append(message);
            log.debug("[Telegram] Stored message {} from chat {}", message.getMessageId(), chatId);
        } catch (DuplicateMessageException e) {
            log.debug("[Telegram] Duplicate message {} in chat {}, ignoring", message.getMessageId(), chatId);
        } catch (StorageException e) {
            log.error("[Telegram] Failed to store message {} from chat {}", message.getMessageId(), chatId, e);
        }
    }

    private void handleCommand(org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage,
            String text) {
        String[] parts = text.trim().split("\\s+", 2);
        String cmd = parts[0].substring(1).split("@")[0];

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null || !router.hasCommand(cmd)) {
            return;
        }

        String chatId = telegramMessage.getChatId().toString();
        List<String> args = parts.length > 1
                ? Arrays.asList(parts[1].split("\\s+"))
                : List.of();
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("chatId", chatId);
        ctx.put("senderId", telegramMessage.getFrom() != null ? telegramMessage.getFrom().getId().toString() : "");
        if (telegramMessage.getChat() != null && telegramMessage.getChat().getTitle() != null) {
            ctx.put("chatTitle", telegramMessage.getChat().getTitle());
        }

        try {
            var result = router.execute(cmd, args, ctx).join();
            reply(chatId, result.output());
        } catch (RuntimeException e) {
            log.error("[Telegram] Command execution failed: /{}", cmd, e);
            reply(chatId, "Command failed: " + e.getMessage());
        }
    }

    private void reply(String chatId, String text) {
        sendMessage(chatId, text).exceptionally(e -> {
            log.warn("[Telegram] Failed to reply in chat {}: {}", chatId, e.getMessage());
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            if (telegramClient == null) {
                throw DeliveryException.permanent("Telegram client not initialized", null);
            }
            SendMessage sendMessage = SendMessage.builder()
                    .chatId(chatId)
                    .text(content)
                    .parseMode("HTML")
                    .build();
            try {
                telegramClient.execute(sendMessage);
            } catch (TelegramApiRequestException e) {
                throw toDeliveryException(chatId, e);
            } catch (TelegramApiException e) {
                throw DeliveryException.retryable("Telegram request to chat " + chatId + " failed: "
                        + e.getMessage(), e);
            }
        });
    }

    DeliveryException toDeliveryException(String chatId, TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        String description = "Telegram rejected message to chat " + chatId + " (" + errorCode + "): "
                + e.getApiResponse();
        if (errorCode != null && errorCode == HTTP_TOO_MANY_REQUESTS) {
            Duration retryAfter = e.getParameters() != null && e.getParameters().getRetryAfter() != null
                    ? Duration.ofSeconds(e.getParameters().getRetryAfter())
                    : null;
            return DeliveryException.rateLimited(description, retryAfter, e);
        }
        if (errorCode == null || errorCode >= HTTP_SERVER_ERROR) {
            return DeliveryException.retryable(description, e);
        }
        return DeliveryException.permanent(description, e);
    }

    private static String displayName(User user) {
        if (user == null) {
            return null;
        }
        if (user.getUserName() != null && !user.getUserName().isBlank()) {
            return user.getUserName();
        }
        String lastName = user.getLastName() != null ? " " + user.getLastName() : "";
        return user.getFirstName() + lastName;
    }
}
