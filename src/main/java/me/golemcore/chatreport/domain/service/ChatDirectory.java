package me.golemcore.chatreport.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.Chat;
import me.golemcore.chatreport.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Whitelist of monitored chats, persisted in {@code chats/chats.json}.
 *
 * <p>
 * Chats keep their registration order; the report pipeline processes them in
 * that order.
 */
@Service
@Slf4j
public class ChatDirectory {

    private static final String CHATS_DIR = "chats";
    private static final String CHATS_FILE = "chats.json";
    private static final TypeReference<List<Chat>> CHAT_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private List<Chat> chatsCache;

    public ChatDirectory(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public synchronized List<Chat> getEnabledChats() {
        return getChats().stream()
                .filter(Chat::isEnabled)
                .map(ChatDirectory::copy)
                .toList();
    }

    public synchronized List<Chat> listChats() {
        return getChats().stream()
                .map(ChatDirectory::copy)
                .toList();
    }

    public synchronized Optional<Chat> findChat(long chatId) {
        return find(chatId).map(ChatDirectory::copy);
    }

    public synchronized boolean isEnabled(long chatId) {
        return find(chatId).map(Chat::isEnabled).orElse(false);
    }

    /**
     * Register a chat or re-enable an existing one. A blank name keeps the stored
     * name.
     */
    public synchronized Chat addOrUpdateChat(long chatId, String name) {
        Optional<Chat> existing = find(chatId);
        Chat chat;
        if (existing.isPresent()) {
            chat = existing.get();
            chat.setEnabled(true);
            if (name != null && !name.isBlank()) {
                chat.setName(name);
            }
            log.info("[Chats] Re-enabled chat {} ({})", chatId, chat.getName());
        } else {
            chat = Chat.builder()
                    .chatId(chatId)
                    .name(name != null && !name.isBlank() ? name : "Chat " + chatId)
                    .enabled(true)
                    .createdAt(clock.instant())
                    .build();
            getChats().add(chat);
            log.info("[Chats] Added chat {} ({})", chatId, chat.getName());
        }
        saveChats();
        return copy(chat);
    }

    /**
     * Disable a chat. Collected data is kept.
     *
     * @return false if the chat is unknown
     */
    public synchronized boolean disableChat(long chatId) {
        Optional<Chat> existing = find(chatId);
        if (existing.isEmpty()) {
            return false;
        }
        existing.get().setEnabled(false);
        saveChats();
        log.info("[Chats] Disabled chat {}", chatId);
        return true;
    }

    public synchronized void markReportSent(long chatId, Instant sentAt) {
        find(chatId).ifPresent(chat -> {
            chat.setLastReportSentAt(sentAt);
            saveChats();
        });
    }

    private Optional<Chat> find(long chatId) {
        return getChats().stream()
                .filter(chat -> chat.getChatId() == chatId)
                .findFirst();
    }

    private List<Chat> getChats() {
        if (chatsCache == null) {
            chatsCache = loadChats();
        }
        return chatsCache;
    }

    private void saveChats() {
        try {
            String json = objectMapper.writeValueAsString(chatsCache);
            StorageFutures.join(storagePort.putTextAtomic(CHATS_DIR, CHATS_FILE, json, true));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize chats", e);
        }
    }

    private List<Chat> loadChats() {
        String json = StorageFutures.join(storagePort.getText(CHATS_DIR, CHATS_FILE));
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, CHAT_LIST_TYPE_REF));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to parse " + CHATS_DIR + "/" + CHATS_FILE, e);
        }
    }

    private static Chat copy(Chat chat) {
        return Chat.builder()
                .chatId(chat.getChatId())
                .name(chat.getName())
                .enabled(chat.isEnabled())
                .createdAt(chat.getCreatedAt())
                .lastReportSentAt(chat.getLastReportSentAt())
                .build();
    }
}
