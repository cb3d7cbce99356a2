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

import me.golemcore.chatreport.domain.model.LlmRequest;
import me.golemcore.chatreport.domain.model.Message;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Builds the single analysis request for one chat window.
 *
 * <p>
 * Every message becomes one line
 * {@code [yyyy-MM-dd HH:mm:ss] <sender> (ID: <messageId>): <text>} with the
 * timestamp in UTC, in window order.
 */
@Component
public class AnalysisPromptBuilder {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private static final String SYSTEM_PROMPT = """
            You analyze group chat transcripts and report which messages are questions \
            and which later messages answer them. You reply with a single JSON object and nothing else.""";

    private static final String INSTRUCTIONS = """
            Find in the messages below:

            1. Questions: messages that request information or clarification.
               Ignore rhetorical questions and greetings. Treat a multi-part question as one question.
               Assign each question a category: technical, business or other.
            2. Answers: messages that respond to one of the questions.
               Reference the question by its message ID. When several messages answer the same
               question, use the first substantive one.
            3. Summary: total questions, answered, unanswered and the average response time in minutes.

            Response time is measured from the question timestamp to the answer timestamp.
            Only use message IDs that appear in the list.

            Messages:
            %s

            Reply with JSON only, no prose and no code fences, in exactly this shape:
            {
              "questions": [
                {
                  "message_id": 123,
                  "text": "question text",
                  "category": "technical|business|other",
                  "is_answered": true,
                  "answer_message_id": 124,
                  "response_time_minutes": 15.5
                }
              ],
              "answers": [
                {
                  "message_id": 124,
                  "text": "answer text",
                  "answers_to_message_id": 123
                }
              ],
              "summary": {
                "total_questions": 1,
                "answered": 1,
                "unanswered": 0,
                "avg_response_time_minutes": 15.5
              }
            }
            For an unanswered question set "is_answered" to false and both "answer_message_id" \
            and "response_time_minutes" to null.""";

    public LlmRequest build(List<Message> messages, int maxTokens, double temperature) {
        return LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(INSTRUCTIONS.formatted(formatMessages(messages)))
                .maxTokens(maxTokens)
                .temperature(temperature)
                .build();
    }

    String formatMessages(List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        for (Message message : messages) {
            if (!sb.isEmpty()) {
                sb.append('\n');
            }
            sb.append('[').append(TIMESTAMP_FORMAT.format(message.getSentAt())).append("] ")
                    .append(message.getSenderLabel())
                    .append(" (ID: ").append(message.getMessageId()).append("): ")
                    .append(message.getText() != null ? message.getText() : "");
        }
        return sb.toString();
    }
}
