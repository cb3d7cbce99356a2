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

import java.util.ArrayList;
import java.util.List;

/**
 * Validated output of one analysis call for one chat window.
 *
 * <p>
 * Instances are only produced by
 * {@link me.golemcore.chatreport.domain.service.AnalysisResponseParser}, which
 * guarantees that every answer references a question of the same result and
 * that unanswered questions carry neither an answer id nor a response time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    @Builder.Default
    private List<QuestionAnalysis> questions = new ArrayList<>();

    @Builder.Default
    private List<AnswerAnalysis> answers = new ArrayList<>();

    @Builder.Default
    private AnalysisSummary summary = AnalysisSummary.empty();

    @JsonIgnore
    public List<QuestionAnalysis> getUnansweredQuestions() {
        return questions.stream()
                .filter(q -> !q.isAnswered())
                .toList();
    }
}
