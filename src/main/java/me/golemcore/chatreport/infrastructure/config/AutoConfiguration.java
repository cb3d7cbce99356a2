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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.service.Sleeper;
import me.golemcore.chatreport.domain.service.ThreadSleeper;
import me.golemcore.chatreport.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Shared beans and startup wiring.
 *
 * <p>
 * Logs the effective report configuration and starts every enabled input
 * channel once the context is ready.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static Sleeper sleeper() {
        return new ThreadSleeper();
    }

    @PostConstruct
    public void init() {
        BotProperties.ReportProperties report = properties.getReport();
        log.info("Chat Report Bot starting...");
        log.info("LLM Provider: {} ({})", properties.getLlm().getProvider(), properties.getLlm().getModel());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Report schedule: {}:{} {} (tag {})", report.getHour(),
                String.format("%02d", report.getMinute()), report.getZone(), report.getTag());
        if (report.getAdminChatId() == null || report.getAdminChatId().isBlank()) {
            log.warn("No admin chat configured, escalations will only be logged");
        }

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        log.info("Chat Report Bot started successfully");
    }
}
