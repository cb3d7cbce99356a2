package me.golemcore.chatreport.domain.pipeline;

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
import me.golemcore.chatreport.domain.exception.AnalysisAuthenticationException;
import me.golemcore.chatreport.domain.exception.AnalysisException;
import me.golemcore.chatreport.domain.exception.AnalysisRateLimitedException;
import me.golemcore.chatreport.domain.exception.AnalysisTransientException;
import me.golemcore.chatreport.domain.exception.MalformedAnalysisResponseException;
import me.golemcore.chatreport.domain.exception.StorageException;
import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.AnalysisSummary;
import me.golemcore.chatreport.domain.model.Chat;
import me.golemcore.chatreport.domain.model.ChatReport;
import me.golemcore.chatreport.domain.model.DeliveryResult;
import me.golemcore.chatreport.domain.model.FailureKind;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.domain.model.PipelineRunState;
import me.golemcore.chatreport.domain.model.PipelineRunSummary;
import me.golemcore.chatreport.domain.model.Report;
import me.golemcore.chatreport.domain.service.AnalysisClient;
import me.golemcore.chatreport.domain.service.ChatDirectory;
import me.golemcore.chatreport.domain.service.DeliveryDispatcher;
import me.golemcore.chatreport.domain.service.MessageStore;
import me.golemcore.chatreport.domain.service.ReportFormatter;
import me.golemcore.chatreport.domain.service.ReportStore;
import me.golemcore.chatreport.domain.service.RetentionCleanupService;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daily report run over every enabled chat.
 *
 * <p>
 * Phase one generates a report per chat: window, analysis, annotation,
 * formatting and persistence. A failure in one chat is counted by kind and the
 * run moves on. Phase two hands all generated reports to the
 * {@link DeliveryDispatcher} in directory order.
 *
 * <p>
 * Provider authentication failure aborts the run and notifies the admin chat.
 * Only one run executes at a time; a concurrent call returns an
 * {@link PipelineRunState#ABORTED} summary without touching any chat.
 */
@Service
@Slf4j
public class ReportPipeline {

    private final ChatDirectory chatDirectory;
    private final MessageStore messageStore;
    private final AnalysisClient analysisClient;
    private final ReportFormatter reportFormatter;
    private final ReportStore reportStore;
    private final DeliveryDispatcher deliveryDispatcher;
    private final RetentionCleanupService retentionCleanupService;
    private final BotProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile PipelineRunState state = PipelineRunState.IDLE;
    private volatile PipelineRunSummary lastRun;

    public ReportPipeline(ChatDirectory chatDirectory, MessageStore messageStore, AnalysisClient analysisClient,
            ReportFormatter reportFormatter, ReportStore reportStore, DeliveryDispatcher deliveryDispatcher,
            RetentionCleanupService retentionCleanupService, BotProperties properties, Clock clock) {
        this.chatDirectory = chatDirectory;
        this.messageStore = messageStore;
        this.analysisClient = analysisClient;
        this.reportFormatter = reportFormatter;
        this.reportStore = reportStore;
        this.deliveryDispatcher = deliveryDispatcher;
        this.retentionCleanupService = retentionCleanupService;
        this.properties = properties;
        this.clock = clock;
    }

    public PipelineRunSummary run() {
        if (!running.compareAndSet(false, true)) {
            log.warn("[Pipeline] Run requested while another run is in progress, ignoring");
            return PipelineRunSummary.aborted(clock.instant(), "Another run is in progress");
        }
        cancelRequested.set(false);
        state = PipelineRunState.RUNNING;
        PipelineRunSummary summary = null;
        try {
            summary = execute();
            return summary;
        } finally {
            if (summary == null) {
                summary = PipelineRunSummary.aborted(clock.instant(), "Run failed unexpectedly");
            }
            state = summary.getState();
            lastRun = summary;
            running.set(false);
        }
    }

    /**
     * Retention sweep entry point for the scheduler.
     */
    public int runCleanup() {
        return retentionCleanupService.cleanup();
    }

    /**
     * Ask the current run to stop before the next chat.
     */
    public void cancel() {
        if (running.get()) {
            log.info("[Pipeline] Cancellation requested");
            cancelRequested.set(true);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public PipelineRunState getState() {
        return state;
    }

    public Optional<PipelineRunSummary> getLastRun() {
        return Optional.ofNullable(lastRun);
    }

    private PipelineRunSummary execute() {
        Instant startedAt = clock.instant();
        ZoneId zone = ZoneId.of(properties.getReport().getZone());
        LocalDate reportDate = LocalDate.ofInstant(startedAt, zone);
        Instant since = startedAt.minus(Duration.ofHours(properties.getReport().getLookbackHours()));

        PipelineRunSummary summary = PipelineRunSummary.builder()
                .state(PipelineRunState.RUNNING)
                .reportDate(reportDate)
                .startedAt(startedAt)
                .build();

        List<Chat> chats;
        try {
            chats = chatDirectory.getEnabledChats();
        } catch (StorageException e) {
            log.error("[Pipeline] Cannot load chat directory", e);
            return finish(summary, PipelineRunState.ABORTED, "Chat directory unavailable: " + e.getMessage());
        }
        log.info("[Pipeline] Starting report run for {} ({} enabled chats)", reportDate, chats.size());

        List<ChatReport> generated = new ArrayList<>();
        for (Chat chat : chats) {
            if (isCancelled()) {
                log.warn("[Pipeline] Run cancelled after {} chats", summary.getChatsProcessed());
                return finish(summary, PipelineRunState.ABORTED, "Cancelled");
            }
            try {
                Optional<ChatReport> report = processChat(chat, reportDate, since, summary);
                report.ifPresent(generated::add);
            } catch (AnalysisAuthenticationException e) {
                log.error("[Pipeline] Chat {}: provider authentication failed, aborting run", chat.getChatId(), e);
                deliveryDispatcher.notifyAdmin("🛑 <b>Daily report run aborted</b>\n"
                        + "The analysis provider rejected the credentials. No reports were delivered.");
                return finish(summary, PipelineRunState.ABORTED, "Analysis provider authentication failed");
            } catch (AnalysisException e) {
                FailureKind kind = classify(e);
                log.error("[Pipeline] Chat {}: analysis failed ({}): {}", chat.getChatId(), kind, e.getMessage());
                summary.recordFailure(chat.getChatId(), kind);
            } catch (StorageException e) {
                log.error("[Pipeline] Chat {}: storage failure", chat.getChatId(), e);
                summary.recordFailure(chat.getChatId(), FailureKind.STORAGE);
            }
        }

        if (isCancelled()) {
            return finish(summary, PipelineRunState.ABORTED, "Cancelled");
        }

        DeliveryResult delivery = deliveryDispatcher.deliverAll(generated);
        summary.setDelivery(delivery);
        for (Long chatId : delivery.getFailedChatIds()) {
            summary.recordFailure(chatId, FailureKind.DELIVERY);
        }

        PipelineRunState finalState = summary.totalFailures() > 0
                ? PipelineRunState.COMPLETED_WITH_FAILURES
                : PipelineRunState.COMPLETED;
        return finish(summary, finalState, null);
    }

    private Optional<ChatReport> processChat(Chat chat, LocalDate reportDate, Instant since,
            PipelineRunSummary summary) {
        long chatId = chat.getChatId();
        List<Message> window = messageStore.windowSince(chatId, since);
        if (window.isEmpty()) {
            log.info("[Pipeline] Chat {}: no messages since {}, skipping", chatId, since);
            summary.setChatsSkipped(summary.getChatsSkipped() + 1);
            return Optional.empty();
        }

        Optional<Report> existing = reportStore.findByChatAndDate(chatId, reportDate);
        if (existing.isPresent() && existing.get().isSent()) {
            log.info("[Pipeline] Chat {}: report for {} already sent, skipping", chatId, reportDate);
            summary.setChatsSkipped(summary.getChatsSkipped() + 1);
            return Optional.empty();
        }

        log.debug("[Pipeline] Chat {}: analyzing {} messages", chatId, window.size());
        AnalysisResult result = analysisClient.analyze(window);
        messageStore.annotate(chatId, result);

        AnalysisSummary totals = result.getSummary();
        Report report = Report.builder()
                .chatId(chatId)
                .chatName(chat.getName())
                .reportDate(reportDate)
                .generatedAt(clock.instant())
                .questionsCount(totals.getTotalQuestions())
                .answeredCount(totals.getAnswered())
                .unansweredCount(totals.getUnanswered())
                .avgResponseTimeMinutes(totals.getAvgResponseTimeMinutes())
                .content(reportFormatter.format(chat, reportDate, result))
                .analysis(result)
                .build();
        reportStore.save(report);

        summary.setChatsProcessed(summary.getChatsProcessed() + 1);
        summary.setReportsGenerated(summary.getReportsGenerated() + 1);
        log.info("[Pipeline] Chat {}: report generated ({} questions)", chatId, totals.getTotalQuestions());
        return Optional.of(new ChatReport(chat, report));
    }

    private boolean isCancelled() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }

    private PipelineRunSummary finish(PipelineRunSummary summary, PipelineRunState finalState, String reason) {
        summary.setState(finalState);
        summary.setAbortReason(reason);
        summary.setFinishedAt(clock.instant());
        int delivered = summary.getDelivery() != null ? summary.getDelivery().getSent() : 0;
        log.info("[Pipeline] Run for {} finished: {} (processed={}, skipped={}, generated={}, delivered={}, "
                + "failures={})", summary.getReportDate(), finalState, summary.getChatsProcessed(),
                summary.getChatsSkipped(), summary.getReportsGenerated(), delivered, summary.getFailures());
        return summary;
    }

    static FailureKind classify(AnalysisException e) {
        if (e instanceof AnalysisRateLimitedException) {
            return FailureKind.ANALYSIS_RATE_LIMITED;
        }
        if (e instanceof MalformedAnalysisResponseException) {
            return FailureKind.ANALYSIS_MALFORMED;
        }
        if (e instanceof AnalysisTransientException transientException) {
            return transientException.isTimeout() ? FailureKind.ANALYSIS_TIMEOUT : FailureKind.ANALYSIS_TRANSIENT;
        }
        return FailureKind.ANALYSIS_REJECTED;
    }
}
