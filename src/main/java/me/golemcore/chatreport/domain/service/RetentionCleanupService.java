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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes collected messages older than {@code bot.retention.hours}.
 */
@Service
@Slf4j
public class RetentionCleanupService {

    private final MessageStore messageStore;
    private final BotProperties properties;
    private final Clock clock;

    public RetentionCleanupService(MessageStore messageStore, BotProperties properties, Clock clock) {
        this.messageStore = messageStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return number of deleted messages, or -1 if the sweep failed
     */
    public int cleanup() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getRetention().getHours()));
        try {
            int deleted = messageStore.deleteOlderThan(cutoff);
            log.info("[Cleanup] Deleted {} messages older than {}", deleted, cutoff);
            return deleted;
        } catch (RuntimeException e) {
            log.error("[Cleanup] Retention sweep failed", e);
            return -1;
        }
    }
}
