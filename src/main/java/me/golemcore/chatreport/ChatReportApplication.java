package me.golemcore.chatreport;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the chat report bot.
 *
 * <p>
 * Collects text messages from monitored Telegram group chats, asks an LLM once
 * a day to find questions and their answers, and posts a response-time report
 * back into each chat.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → TelegramAdapter, CommandRouter, SystemController
 * Domain Layer       → ReportPipeline, AnalysisClient, DeliveryDispatcher, stores
 * Infrastructure     → LLM/Storage adapters, ReportScheduler
 * </pre>
 *
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChatReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatReportApplication.class, args);
    }

}
