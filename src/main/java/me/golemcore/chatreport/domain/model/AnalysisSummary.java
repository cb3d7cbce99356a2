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

/**
 * Totals of one analysis result. {@code avgResponseTimeMinutes} is null when
 * nothing was answered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisSummary {

    private int totalQuestions;
    private int answered;
    private int unanswered;
    private Double avgResponseTimeMinutes;

    public static AnalysisSummary empty() {
        return new AnalysisSummary(0, 0, 0, null);
    }
}
