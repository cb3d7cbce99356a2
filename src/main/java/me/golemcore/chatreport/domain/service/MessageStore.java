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
import me.golemcore.chatreport.domain.exception.DuplicateMessageException;
import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.AnswerAnalysis;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.domain.model.QuestionAnalysis;
import me.golemcore.chatreport.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Durable log of collected chat messages.
 *
 * <p>
 * Each chat is persisted as one JSON array in {@code messages/<chatId>.json}
 * and rewritten atomically on every change. A per-chat index keyed by message
 * id is kept in memory after the first access. All operations are serialized
 * on the store, so a window read never observes a half-applied append.
 */
@Service
@Slf4j
public class MessageStore {

    private static final String MESSAGES_DIR = "messages";
    private static final String FILE_SUFFIX = ".json";
    private static final TypeReference<List<Message>> MESSAGE_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<Long, Map<Long, Message>> chats = new HashMap<>();

    public MessageStore(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Persist a new message.
     *
     * @throws DuplicateMessageException
     *             if the chat already holds a message with the same id
     */
    public synchronized void append(Message message) {
        Objects.requireNonNull(message.getSentAt(), "sentAt");
        Map<Long, Message> index = index(message.getChatId());
        if (index.containsKey(message.getMessageId())) {
            throw new DuplicateMessageException(message.getChatId(), message.getMessageId());
        }

        Message stored = copy(message);
        if (stored.getCreatedAt() == null) {
            stored.setCreatedAt(clock.instant());
        }
        index.put(stored.getMessageId(), stored);
        try {
            persist(message.getChatId(), index);
        } catch (StorageException e) {
            index.remove(stored.getMessageId());
            throw e;
        }
    }

    /**
     * Messages sent at or after {@code since}, ordered by send time then message
     * id.
     */
    public synchronized List<Message> windowSince(long chatId, Instant since) {
        return index(chatId).values().stream()
                .filter(m -> !m.getSentAt().isBefore(since))
                .sorted(Message.WINDOW_ORDER)
                .map(MessageStore::copy)
                .toList();
    }

    /**
     * Messages in the half-open interval {@code [from, to)}, same ordering as
     * {@link #windowSince(long, Instant)}.
     */
    public synchronized List<Message> windowBetween(long chatId, Instant from, Instant to) {
        return index(chatId).values().stream()
                .filter(m -> !m.getSentAt().isBefore(from) && m.getSentAt().isBefore(to))
                .sorted(Message.WINDOW_ORDER)
                .map(MessageStore::copy)
                .toList();
    }

    /**
     * Store the question/answer flags produced by an analysis. Ids the store does
     * not know are ignored.
     *
     * @return number of messages updated
     */
    public synchronized int annotate(long chatId, AnalysisResult result) {
        Map<Long, Message> index = index(chatId);
        int updated = 0;
        for (QuestionAnalysis question : result.getQuestions()) {
            Message message = index.get(question.getMessageId());
            if (message != null) {
                message.setQuestion(true);
                updated++;
            }
            if (question.isAnswered() && question.getAnswerMessageId() != null) {
                updated += markAnswer(index, question.getAnswerMessageId(), question.getMessageId());
            }
        }
        for (AnswerAnalysis answer : result.getAnswers()) {
            Message message = index.get(answer.getMessageId());
            if (message != null && !message.isAnswer()) {
                updated += markAnswer(index, answer.getMessageId(), answer.getAnswersMessageId());
            }
        }
        if (updated > 0) {
            persist(chatId, index);
        }
        return updated;
    }

    /**
     * Delete every message sent before {@code cutoff}, across all chats.
     *
     * @return number of deleted messages
     */
    public synchronized int deleteOlderThan(Instant cutoff) {
        int deleted = 0;
        for (long chatId : storedChatIds()) {
            Map<Long, Message> index = index(chatId);
            int before = index.size();
            index.values().removeIf(m -> m.getSentAt().isBefore(cutoff));
            int removed = before - index.size();
            if (removed > 0) {
                persist(chatId, index);
                deleted += removed;
                log.debug("[Storage] Deleted {} messages from chat {}", removed, chatId);
            }
        }
        return deleted;
    }

    private int markAnswer(Map<Long, Message> index, long answerId, long questionId) {
        Message message = index.get(answerId);
        if (message == null) {
            return 0;
        }
        message.setAnswer(true);
        message.setAnswersMessageId(questionId);
        return 1;
    }

    private List<Long> storedChatIds() {
        List<Long> ids = new ArrayList<>(chats.keySet());
        for (String file : StorageFutures.join(storagePort.listObjects(MESSAGES_DIR, ""))) {
            if (!file.endsWith(FILE_SUFFIX) || file.contains("/")) {
                continue;
            }
            try {
                long chatId = Long.parseLong(file.substring(0, file.length() - FILE_SUFFIX.length()));
                if (!ids.contains(chatId)) {
                    ids.add(chatId);
                }
            } catch (NumberFormatException e) {
                log.warn("[Storage] Ignoring unexpected file in messages/: {}", file);
            }
        }
        return ids;
    }

    private Map<Long, Message> index(long chatId) {
        return chats.computeIfAbsent(chatId, this::load);
    }

    private Map<Long, Message> load(long chatId) {
        String json = StorageFutures.join(storagePort.getText(MESSAGES_DIR, fileName(chatId)));
        Map<Long, Message> index = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return index;
        }
        try {
            for (Message message : objectMapper.readValue(json, MESSAGE_LIST_TYPE_REF)) {
                index.put(message.getMessageId(), message);
            }
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to parse messages of chat " + chatId, e);
        }
        return index;
    }

    private void persist(long chatId, Map<Long, Message> index) {
        List<Message> ordered = index.values().stream()
                .sorted(Message.WINDOW_ORDER)
                .toList();
        try {
            String json = objectMapper.writeValueAsString(ordered);
            StorageFutures.join(storagePort.putTextAtomic(MESSAGES_DIR, fileName(chatId), json, false));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize messages of chat " + chatId, e);
        }
    }

    private static String fileName(long chatId) {
        return chatId + FILE_SUFFIX;
    }

    private static Message copy(Message message) {
        return message.toBuilder()
                .reactions(message.getReactions() != null
                        ? new LinkedHashMap<>(message.getReactions())
                        : new LinkedHashMap<>())
                .build();
    }
}
