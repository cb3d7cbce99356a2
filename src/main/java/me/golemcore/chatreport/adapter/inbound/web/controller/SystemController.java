package me.golemcore.chatreport.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.chatreport.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.domain.model.PipelineRunSummary;
import me.golemcore.chatreport.domain.model.Report;
import me.golemcore.chatreport.domain.pipeline.ReportPipeline;
import me.golemcore.chatreport.domain.service.MessageStore;
import me.golemcore.chatreport.domain.service.ReportStore;
import me.golemcore.chatreport.port.inbound.ChannelPort;
import me.golemcore.chatreport.port.outbound.StoragePort;
import me.golemcore.chatreport.scheduler.ReportScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * System health and inspection endpoints.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
public class SystemController {

    private static final int MAX_REPORTS = 50;

    private final List<ChannelPort> channelPorts;
    private final StoragePort storagePort;
    private final ReportScheduler reportScheduler;
    private final ReportPipeline reportPipeline;
    private final MessageStore messageStore;
    private final ReportStore reportStore;

    /**
     * {@code UP} when the scheduler runs and storage is writable, otherwise
     * {@code DOWN} with HTTP 503.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<SystemHealthResponse>> health() {
        Map<String, SystemHealthResponse.ChannelStatus> channels = new LinkedHashMap<>();
        for (ChannelPort port : channelPorts) {
            channels.put(port.getChannelType(), SystemHealthResponse.ChannelStatus.builder()
                    .type(port.getChannelType())
                    .running(port.isRunning())
                    .build());
        }

        boolean schedulerRunning = reportScheduler.isRunning();
        boolean storageAvailable = storagePort.isAvailable();
        boolean up = schedulerRunning && storageAvailable;

        SystemHealthResponse response = SystemHealthResponse.builder()
                .status(up ? "UP" : "DOWN")
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .schedulerRunning(schedulerRunning)
                .storageAvailable(storageAvailable)
                .nextReportRun(reportScheduler.getNextReportRun().orElse(null))
                .nextCleanupRun(reportScheduler.getNextCleanupRun().orElse(null))
                .pipelineState(reportPipeline.getState().name())
                .channels(channels)
                .lastRun(reportPipeline.getLastRun().map(SystemController::toLastRun).orElse(null))
                .build();
        HttpStatus status = up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return Mono.just(ResponseEntity.status(status).body(response));
    }

    /**
     * Messages of a chat in {@code [from, to)}, ISO-8601 instants.
     */
    @GetMapping("/chats/{chatId}/messages")
    public Mono<ResponseEntity<List<Message>>> messages(@PathVariable long chatId,
            @RequestParam String from, @RequestParam String to) {
        Instant fromInstant = parseInstant(from, "from");
        Instant toInstant = parseInstant(to, "to");
        if (!fromInstant.isBefore(toInstant)) {
            throw new IllegalArgumentException("'from' must be before 'to'");
        }
        return Mono.fromCallable(() -> messageStore.windowBetween(chatId, fromInstant, toInstant))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/chats/{chatId}/reports")
    public Mono<ResponseEntity<List<Report>>> reports(@PathVariable long chatId,
            @RequestParam(defaultValue = "7") int limit) {
        if (limit < 1 || limit > MAX_REPORTS) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_REPORTS);
        }
        return Mono.fromCallable(() -> reportStore.findRecent(chatId, limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private static Instant parseInstant(String value, String name) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid '" + name + "' timestamp: " + value, e);
        }
    }

    private static SystemHealthResponse.LastRun toLastRun(PipelineRunSummary summary) {
        return SystemHealthResponse.LastRun.builder()
                .state(summary.getState().name())
                .reportDate(summary.getReportDate() != null ? summary.getReportDate().toString() : null)
                .startedAt(summary.getStartedAt())
                .finishedAt(summary.getFinishedAt())
                .reportsGenerated(summary.getReportsGenerated())
                .failures(summary.totalFailures())
                .abortReason(summary.getAbortReason())
                .build();
    }
}
