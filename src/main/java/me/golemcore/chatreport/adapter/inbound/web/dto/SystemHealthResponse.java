package me.golemcore.chatreport.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Health payload: overall status plus scheduler, storage, channel and last run
 * details.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemHealthResponse {
    private String status;
    private long uptimeMs;
    private boolean schedulerRunning;
    private boolean storageAvailable;
    private Instant nextReportRun;
    private Instant nextCleanupRun;
    private String pipelineState;
    private Map<String, ChannelStatus> channels;
    private LastRun lastRun;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelStatus {
        private String type;
        private boolean running;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LastRun {
        private String state;
        private String reportDate;
        private Instant startedAt;
        private Instant finishedAt;
        private int reportsGenerated;
        private int failures;
        private String abortReason;
    }
}
