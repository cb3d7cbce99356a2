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
import me.golemcore.chatreport.domain.exception.DeliveryException;
import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.ChatReport;
import me.golemcore.chatreport.domain.model.DeliveryResult;
import me.golemcore.chatreport.domain.model.Report;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import me.golemcore.chatreport.port.inbound.ChannelPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Delivers generated reports to their chats.
 *
 * <p>
 * Reports without questions are skipped and never marked sent. Consecutive
 * sends are paced by {@code bot.report.pacing}. Retryable transport failures
 * are retried per chunk with exponential backoff, honouring the server's
 * retry-after hint. When the share of failed deliveries exceeds
 * {@code bot.report.escalation-threshold} the admin chat is notified.
 */
@Service
@Slf4j
public class DeliveryDispatcher {

    private final ChannelPort channelPort;
    private final ReportStore reportStore;
    private final ChatDirectory chatDirectory;
    private final ReportFormatter reportFormatter;
    private final BotProperties properties;
    private final Sleeper sleeper;
    private final Clock clock;

    public DeliveryDispatcher(ChannelPort channelPort, ReportStore reportStore, ChatDirectory chatDirectory,
            ReportFormatter reportFormatter, BotProperties properties, Sleeper sleeper, Clock clock) {
        this.channelPort = channelPort;
        this.reportStore = reportStore;
        this.chatDirectory = chatDirectory;
        this.reportFormatter = reportFormatter;
        this.properties = properties;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public DeliveryResult deliverAll(List<ChatReport> reports) {
        DeliveryResult result = DeliveryResult.builder().total(reports.size()).build();
        boolean previousSend = false;
        boolean interrupted = false;

        for (ChatReport chatReport : reports) {
            Report report = chatReport.report();
            long chatId = chatReport.chat().getChatId();

            if (interrupted || Thread.currentThread().isInterrupted()) {
                interrupted = true;
                recordFailure(result, chatId);
                continue;
            }

            if (!report.hasQuestions()) {
                result.setSkipped(result.getSkipped() + 1);
                log.info("[Delivery] Chat {}: no questions, report not sent", chatId);
                continue;
            }

            if (previousSend && !pace()) {
                interrupted = true;
                recordFailure(result, chatId);
                continue;
            }
            previousSend = true;

            try {
                send(String.valueOf(chatId), report.getContent());
            } catch (DeliveryException e) {
                log.error("[Delivery] Chat {}: delivery failed: {}", chatId, e.getMessage());
                recordFailure(result, chatId);
                continue;
            }

            result.setSent(result.getSent() + 1);
            markSent(chatReport);
            log.info("[Delivery] Chat {}: report delivered", chatId);
        }

        if (!interrupted && shouldEscalate(result)) {
            result.setEscalated(escalateDeliveryFailures(result));
        }
        log.info("[Delivery] Batch finished: {} total, {} sent, {} skipped, {} failed",
                result.getTotal(), result.getSent(), result.getSkipped(), result.getFailed());
        return result;
    }

    /**
     * Send a notice to the configured admin chat. Single attempt.
     *
     * @return true if the notice was delivered
     */
    public boolean notifyAdmin(String text) {
        String adminChatId = properties.getReport().getAdminChatId();
        if (adminChatId == null || adminChatId.isBlank()) {
            log.warn("[Delivery] No admin chat configured, dropping notice: {}", text);
            return false;
        }
        try {
            sendOnce(adminChatId, text);
            return true;
        } catch (DeliveryException e) {
            log.error("[Delivery] Failed to notify admin chat {}: {}", adminChatId, e.getMessage());
            return false;
        }
    }

    boolean shouldEscalate(DeliveryResult result) {
        return result.getTotal() > 0 && result.failureRate() > properties.getReport().getEscalationThreshold();
    }

    private boolean escalateDeliveryFailures(DeliveryResult result) {
        int limit = properties.getReport().getEscalationMaxChatIds();
        List<Long> failed = result.getFailedChatIds();
        String listed = failed.stream()
                .limit(limit)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        if (failed.size() > limit) {
            listed += " (+" + (failed.size() - limit) + " more)";
        }
        String text = "⚠️ <b>Report delivery failures</b>\n"
                + "Failed: " + result.getFailed() + " of " + result.getTotal() + " chats\n"
                + "Chat IDs: " + listed;
        log.warn("[Delivery] Failure rate {} exceeds threshold, escalating", String.format("%.2f",
                result.failureRate()));
        return notifyAdmin(text);
    }

    private void send(String chatId, String content) {
        for (String chunk : reportFormatter.split(content, properties.getReport().getMaxMessageLength())) {
            sendWithRetry(chatId, chunk);
        }
    }

    private void sendWithRetry(String chatId, String chunk) {
        BotProperties.ReportProperties report = properties.getReport();
        RetryPolicy retryPolicy = RetryPolicy.of(report.getMaxAttempts(), report.getInitialBackoff(),
                report.getMaxBackoff());
        for (int attempt = 1;; attempt++) {
            try {
                sendOnce(chatId, chunk);
                return;
            } catch (DeliveryException e) {
                if (!e.isRetryable() || !retryPolicy.canRetry(attempt)) {
                    throw e;
                }
                Duration delay = retryPolicy.delayForAttempt(attempt, e.getRetryAfter().orElse(null));
                log.warn("[Delivery] Chat {}: attempt {}/{} failed ({}), retrying in {}ms",
                        chatId, attempt, retryPolicy.maxAttempts(), e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw DeliveryException.permanent("Delivery interrupted", ie);
                }
            }
        }
    }

    private void sendOnce(String chatId, String text) {
        Duration timeout = properties.getReport().getSendTimeout();
        CompletableFuture<Void> future = channelPort.sendMessage(chatId, text);
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw DeliveryException.retryable("Send timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof DeliveryException deliveryException) {
                throw deliveryException;
            }
            throw DeliveryException.retryable("Send failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw DeliveryException.permanent("Delivery interrupted", e);
        }
    }

    private boolean pace() {
        try {
            sleeper.sleep(properties.getReport().getPacing());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void markSent(ChatReport chatReport) {
        Instant now = clock.instant();
        try {
            reportStore.markSent(chatReport.report(), now);
            chatDirectory.markReportSent(chatReport.chat().getChatId(), now);
        } catch (StorageException e) {
            log.error("[Delivery] Chat {}: report delivered but sent state not persisted",
                    chatReport.chat().getChatId(), e);
        }
    }

    private static void recordFailure(DeliveryResult result, long chatId) {
        result.setFailed(result.getFailed() + 1);
        result.getFailedChatIds().add(chatId);
    }
}
