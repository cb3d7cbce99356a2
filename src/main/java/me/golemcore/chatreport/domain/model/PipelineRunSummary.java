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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one {@code ReportPipeline.run()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunSummary {

    private PipelineRunState state;
    private LocalDate reportDate;
    private Instant startedAt;
    private Instant finishedAt;
    private int chatsProcessed;
    private int chatsSkipped;
    private int reportsGenerated;

    @Builder.Default
    private Map<FailureKind, Integer> failures = new EnumMap<>(FailureKind.class);

    /**
     * Failure kind per chat id, in processing order.
     */
    @Builder.Default
    private Map<Long, FailureKind> failedChats = new LinkedHashMap<>();

    private DeliveryResult delivery;
    private String abortReason;

    public void recordFailure(long chatId, FailureKind kind) {
        failures.merge(kind, 1, Integer::sum);
        failedChats.put(chatId, kind);
    }

    public int failureCount(FailureKind kind) {
        return failures.getOrDefault(kind, 0);
    }

    public int totalFailures() {
        return failures.values().stream().mapToInt(Integer::intValue).sum();
    }

    public static PipelineRunSummary aborted(Instant at, String reason) {
        return PipelineRunSummary.builder()
                .state(PipelineRunState.ABORTED)
                .startedAt(at)
                .finishedAt(at)
                .abortReason(reason)
                .build();
    }
}
