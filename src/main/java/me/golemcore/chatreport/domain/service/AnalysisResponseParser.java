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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.exception.MalformedAnalysisResponseException;
import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.AnalysisSummary;
import me.golemcore.chatreport.domain.model.AnswerAnalysis;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.domain.model.QuestionAnalysis;
import me.golemcore.chatreport.domain.model.QuestionCategory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the provider's raw reply into a validated {@link AnalysisResult}.
 *
 * <p>
 * Markdown fences and prose around the outermost JSON object are stripped.
 * Anything inconsistent with the submitted window is rejected with
 * {@link MalformedAnalysisResponseException}; nothing is repaired.
 *
 * <p>
 * For an answered question the candidates are its {@code answer_message_id}
 * plus every answer entry pointing at it. The earliest candidate sent at or
 * after the question wins, and the response time is recomputed from the two
 * window timestamps.
 */
@Component
@Slf4j
public class AnalysisResponseParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*(\\{.*})\\s*```", Pattern.DOTALL);
    private static final double SECONDS_PER_MINUTE = 60.0;

    private final ObjectMapper objectMapper;

    public AnalysisResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AnalysisResult parse(String rawResponse, List<Message> window) {
        JsonNode root = readJson(extractJson(rawResponse));
        Map<Long, Message> byId = new HashMap<>();
        for (Message message : window) {
            byId.put(message.getMessageId(), message);
        }

        JsonNode questionsNode = root.get("questions");
        if (questionsNode == null || !questionsNode.isArray()) {
            throw new MalformedAnalysisResponseException("Missing 'questions' array");
        }
        JsonNode answersNode = root.get("answers");
        if (answersNode != null && !answersNode.isNull() && !answersNode.isArray()) {
            throw new MalformedAnalysisResponseException("'answers' is not an array");
        }

        Map<Long, RawQuestion> questions = new LinkedHashMap<>();
        for (JsonNode node : questionsNode) {
            RawQuestion question = readQuestion(node, byId);
            if (questions.putIfAbsent(question.messageId, question) != null) {
                throw new MalformedAnalysisResponseException("Duplicate question id " + question.messageId);
            }
        }

        List<RawAnswer> answers = new ArrayList<>();
        if (answersNode != null && answersNode.isArray()) {
            for (JsonNode node : answersNode) {
                answers.add(readAnswer(node, byId, questions));
            }
        }

        List<QuestionAnalysis> validatedQuestions = new ArrayList<>();
        Map<Long, AnswerAnalysis> validatedAnswers = new LinkedHashMap<>();
        for (RawAnswer answer : answers) {
            if (!qualifies(byId.get(answer.questionId), byId.get(answer.messageId))) {
                log.debug("[Analysis] Dropping answer {}: not sent after question {}", answer.messageId,
                        answer.questionId);
                continue;
            }
            validatedAnswers.putIfAbsent(answer.messageId, AnswerAnalysis.builder()
                    .messageId(answer.messageId)
                    .text(answer.text != null ? answer.text : byId.get(answer.messageId).getText())
                    .answersMessageId(answer.questionId)
                    .build());
        }

        int answeredCount = 0;
        double responseTimeSum = 0.0;
        for (RawQuestion question : questions.values()) {
            Message asked = byId.get(question.messageId);
            QuestionAnalysis.QuestionAnalysisBuilder builder = QuestionAnalysis.builder()
                    .messageId(question.messageId)
                    .text(question.text != null && !question.text.isBlank() ? question.text : asked.getText())
                    .category(question.category)
                    .askedAt(asked.getSentAt())
                    .answered(question.answered);

            if (question.answered) {
                Message chosen = chooseAnswer(question, asked, answers, byId);
                double minutes = Duration.between(asked.getSentAt(), chosen.getSentAt()).toMillis()
                        / 1000.0 / SECONDS_PER_MINUTE;
                builder.answerMessageId(chosen.getMessageId()).responseTimeMinutes(minutes);
                validatedAnswers.putIfAbsent(chosen.getMessageId(), AnswerAnalysis.builder()
                        .messageId(chosen.getMessageId())
                        .text(chosen.getText())
                        .answersMessageId(question.messageId)
                        .build());
                answeredCount++;
                responseTimeSum += minutes;
            }
            validatedQuestions.add(builder.build());
        }

        int total = validatedQuestions.size();
        int unanswered = total - answeredCount;
        validateSummary(root.get("summary"), total, answeredCount, unanswered);

        AnalysisSummary summary = AnalysisSummary.builder()
                .totalQuestions(total)
                .answered(answeredCount)
                .unanswered(unanswered)
                .avgResponseTimeMinutes(answeredCount > 0 ? responseTimeSum / answeredCount : null)
                .build();

        return AnalysisResult.builder()
                .questions(validatedQuestions)
                .answers(new ArrayList<>(validatedAnswers.values()))
                .summary(summary)
                .build();
    }

    /**
     * Remove code fences and surrounding prose, keeping the outermost JSON
     * object.
     */
    String extractJson(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new MalformedAnalysisResponseException("Empty analysis response");
        }
        String text = rawResponse.trim();
        Matcher fenced = CODE_FENCE.matcher(text);
        if (fenced.find()) {
            text = fenced.group(1);
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedAnalysisResponseException("No JSON object in analysis response");
        }
        return text.substring(start, end + 1);
    }

    private JsonNode readJson(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new MalformedAnalysisResponseException("Analysis response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new MalformedAnalysisResponseException("Invalid JSON in analysis response: " + e.getOriginalMessage(),
                    e);
        }
    }

    private RawQuestion readQuestion(JsonNode node, Map<Long, Message> byId) {
        long messageId = requireId(node, "message_id", "question");
        if (!byId.containsKey(messageId)) {
            throw new MalformedAnalysisResponseException("Question " + messageId + " is not in the analyzed window");
        }

        JsonNode categoryNode = node.get("category");
        QuestionCategory category = QuestionCategory
                .fromWireName(categoryNode != null && categoryNode.isTextual() ? categoryNode.asText() : null)
                .orElseThrow(() -> new MalformedAnalysisResponseException(
                        "Question " + messageId + " has invalid category " + categoryNode));

        JsonNode answeredNode = node.get("is_answered");
        if (answeredNode == null || !answeredNode.isBoolean()) {
            throw new MalformedAnalysisResponseException("Question " + messageId + " has no boolean 'is_answered'");
        }
        boolean answered = answeredNode.asBoolean();

        Long answerId = optionalId(node, "answer_message_id", "question " + messageId);
        Double responseTime = optionalNumber(node, "response_time_minutes", "question " + messageId);
        if (responseTime != null && responseTime < 0) {
            throw new MalformedAnalysisResponseException("Question " + messageId + " has negative response time");
        }
        if (!answered && (answerId != null || responseTime != null)) {
            throw new MalformedAnalysisResponseException(
                    "Unanswered question " + messageId + " carries an answer id or response time");
        }
        if (answerId != null && !byId.containsKey(answerId)) {
            throw new MalformedAnalysisResponseException(
                    "Answer " + answerId + " of question " + messageId + " is not in the analyzed window");
        }

        return new RawQuestion(messageId, textOrNull(node), category, answered, answerId);
    }

    private RawAnswer readAnswer(JsonNode node, Map<Long, Message> byId, Map<Long, RawQuestion> questions) {
        long messageId = requireId(node, "message_id", "answer");
        if (!byId.containsKey(messageId)) {
            throw new MalformedAnalysisResponseException("Answer " + messageId + " is not in the analyzed window");
        }
        long questionId = requireId(node, "answers_to_message_id", "answer " + messageId);
        RawQuestion question = questions.get(questionId);
        if (question == null) {
            throw new MalformedAnalysisResponseException(
                    "Answer " + messageId + " references unknown question " + questionId);
        }
        if (!question.answered) {
            throw new MalformedAnalysisResponseException(
                    "Answer " + messageId + " references unanswered question " + questionId);
        }
        return new RawAnswer(messageId, textOrNull(node), questionId);
    }

    private Message chooseAnswer(RawQuestion question, Message asked, List<RawAnswer> answers,
            Map<Long, Message> byId) {
        List<Long> candidates = new ArrayList<>();
        if (question.answerId != null) {
            candidates.add(question.answerId);
        }
        for (RawAnswer answer : answers) {
            if (answer.questionId == question.messageId) {
                candidates.add(answer.messageId);
            }
        }

        Message chosen = null;
        for (Long candidateId : candidates) {
            Message candidate = byId.get(candidateId);
            if (!qualifies(asked, candidate)) {
                continue;
            }
            if (chosen == null || Message.WINDOW_ORDER.compare(candidate, chosen) < 0) {
                chosen = candidate;
            }
        }
        if (chosen == null) {
            throw new MalformedAnalysisResponseException(
                    "Answered question " + question.messageId + " has no qualifying answer");
        }
        if (question.answerId != null && chosen.getMessageId() != question.answerId) {
            log.debug("[Analysis] Question {}: earlier answer {} replaces {}", question.messageId,
                    chosen.getMessageId(), question.answerId);
        }
        return chosen;
    }

    private static boolean qualifies(Message asked, Message candidate) {
        return candidate != null
                && candidate.getMessageId() != asked.getMessageId()
                && !candidate.getSentAt().isBefore(asked.getSentAt());
    }

    private void validateSummary(JsonNode summary, int total, int answered, int unanswered) {
        if (summary == null || summary.isNull()) {
            return;
        }
        if (!summary.isObject()) {
            throw new MalformedAnalysisResponseException("'summary' is not an object");
        }
        checkCount(summary, "total_questions", total);
        checkCount(summary, "answered", answered);
        checkCount(summary, "unanswered", unanswered);
        Double avg = optionalNumber(summary, "avg_response_time_minutes", "summary");
        if (avg != null && avg < 0) {
            throw new MalformedAnalysisResponseException("Summary has negative average response time");
        }
    }

    private void checkCount(JsonNode summary, String field, int expected) {
        JsonNode node = summary.get(field);
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber() || node.asInt() != expected) {
            throw new MalformedAnalysisResponseException(
                    "Summary '" + field + "' is " + node + " but the question list gives " + expected);
        }
    }

    private static long requireId(JsonNode node, String field, String owner) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw new MalformedAnalysisResponseException("Missing integer '" + field + "' in " + owner);
        }
        return value.asLong();
    }

    private static Long optionalId(JsonNode node, String field, String owner) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber()) {
            throw new MalformedAnalysisResponseException("'" + field + "' in " + owner + " is not an integer");
        }
        return value.asLong();
    }

    private static Double optionalNumber(JsonNode node, String field, String owner) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new MalformedAnalysisResponseException("'" + field + "' in " + owner + " is not a number");
        }
        return value.asDouble();
    }

    private static String textOrNull(JsonNode node) {
        JsonNode text = node.get("text");
        return text != null && text.isTextual() ? text.asText() : null;
    }

    private record RawQuestion(long messageId, String text, QuestionCategory category, boolean answered,
            Long answerId) {
    }

    private record RawAnswer(long messageId, String text, long questionId) {
    }
}
