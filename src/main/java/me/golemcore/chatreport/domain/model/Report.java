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
import java.time.LocalDate;

/**
 * The persisted, delivery-ready report for one chat on one date. Stored in
 * {@code reports/<chatId>/<date>.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Report {

    private String id;
    private long chatId;
    private String chatName;
    private LocalDate reportDate;
    private Instant generatedAt;
    private int questionsCount;
    private int answeredCount;
    private int unansweredCount;
    private Double avgResponseTimeMinutes;
    private String content;
    private AnalysisResult analysis;
    private Instant sentAt;

    @JsonIgnore
    public boolean isSent() {
        return sentAt != null;
    }

    @JsonIgnore
    public boolean hasQuestions() {
        return questionsCount > 0;
    }
}
