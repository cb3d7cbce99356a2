package me.golemcore.chatreport.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link TelegramProperties} - bot token and admin users</li>
 * <li>{@link LlmProperties} - analysis provider settings</li>
 * <li>{@link StorageProperties} - data directory</li>
 * <li>{@link ReportProperties} - report generation and delivery</li>
 * <li>{@link RetentionProperties} - message retention sweep</li>
 * <li>{@link ScheduleProperties} - daily scheduler</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private TelegramProperties telegram = new TelegramProperties();
    private LlmProperties llm = new LlmProperties();
    private StorageProperties storage = new StorageProperties();
    private ReportProperties report = new ReportProperties();
    private RetentionProperties retention = new RetentionProperties();
    private ScheduleProperties schedule = new ScheduleProperties();

    @Data
    public static class TelegramProperties {
        private boolean enabled = true;
        private String token;
        private List<String> adminUserIds = new ArrayList<>();
    }

    @Data
    public static class LlmProperties {
        /**
         * {@code anthropic} or {@code openai} (any OpenAI-compatible endpoint).
         */
        private String provider = "anthropic";
        private String apiKey;
        private String model = "claude-sonnet-4-20250514";
        private String baseUrl;
        private int maxTokens = 4096;
        private double temperature = 0.0;
        private Duration timeout = Duration.ofSeconds(120);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(5);
        private Duration maxBackoff = Duration.ofSeconds(60);
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.chat-report-bot/data";
    }

    @Data
    public static class ReportProperties {
        private String tag = "#IMFReport";
        private int hour = 10;
        private int minute = 0;
        private String zone = "UTC";
        private int lookbackHours = 24;
        private Duration pacing = Duration.ofSeconds(5);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private Duration sendTimeout = Duration.ofSeconds(30);
        private int maxMessageLength = 4096;
        private double escalationThreshold = 0.5;
        private int escalationMaxChatIds = 10;
        private String adminChatId;
    }

    @Data
    public static class RetentionProperties {
        private int hours = 48;
        private int hour = 2;
        private int minute = 0;
    }

    @Data
    public static class ScheduleProperties {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(30);
        private Duration jitterTolerance = Duration.ofMinutes(2);
    }
}
