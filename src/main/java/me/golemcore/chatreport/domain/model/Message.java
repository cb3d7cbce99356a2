package me.golemcore.chatreport.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A text message collected from a monitored chat.
 *
 * <p>
 * {@code sentAt} is always an {@link Instant}, so ordering and window
 * comparisons happen in UTC regardless of the host zone. The pair
 * {@code (chatId, messageId)} identifies a message; the analysis flags are set
 * in place after the daily analysis.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    /**
     * Window order: send time, then platform message id.
     */
    public static final Comparator<Message> WINDOW_ORDER = Comparator
            .comparing(Message::getSentAt)
            .thenComparingLong(Message::getMessageId);

    private long chatId;
    private long messageId;
    private long senderId;
    private String senderName;
    private String text;
    private Instant sentAt;

    @Builder.Default
    private Map<String, Integer> reactions = new LinkedHashMap<>();

    private Instant createdAt;

    private boolean question;
    private boolean answer;
    private Long answersMessageId;

    /**
     * Display name used in prompts, falls back to the numeric sender id.
     */
    @JsonIgnore
    public String getSenderLabel() {
        if (senderName != null && !senderName.isBlank()) {
            return senderName;
        }
        return "User " + senderId;
    }
}
