package me.golemcore.chatreport.domain.service;

import me.golemcore.chatreport.domain.exception.MalformedAnalysisResponseException;
import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.AnswerAnalysis;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.domain.model.QuestionAnalysis;
import me.golemcore.chatreport.domain.model.QuestionCategory;
import me.golemcore.chatreport.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisResponseParserTest {

    private static final Instant T0 = Instant.parse("2025-01-15T08:00:00Z");
    private static final long CHAT_ID = -100L;

    private final AnalysisResponseParser parser = new AnalysisResponseParser(AutoConfiguration.objectMapper());

    private final List<Message> window = List.of(
            message(1, T0, "How do I configure the webhook?"),
            message(2, T0.plusSeconds(45 * 60), "Set the URL in settings"),
            message(3, T0.plusSeconds(50 * 60), "Nice weather today"),
            message(4, T0.plusSeconds(90 * 60), "What is the price?"));

    private static final String VALID = """
            {
              "questions": [
                {"message_id": 1, "text": "How do I configure the webhook?", "category": "technical",
                 "is_answered": true, "answer_message_id": 2, "response_time_minutes": 45},
                {"message_id": 4, "text": "What is the price?", "category": "business",
                 "is_answered": false, "answer_message_id": null, "response_time_minutes": null}
              ],
              "answers": [
                {"message_id": 2, "text": "Set the URL in settings", "answers_to_message_id": 1}
              ],
              "summary": {"total_questions": 2, "answered": 1, "unanswered": 1, "avg_response_time_minutes": 45}
            }
            """;

    // ===== Happy path =====

    @Test
    void parsesValidResponse() {
        AnalysisResult result = parser.parse(VALID, window);

        assertEquals(2, result.getQuestions().size());
        QuestionAnalysis first = result.getQuestions().get(0);
        assertEquals(QuestionCategory.TECHNICAL, first.getCategory());
        assertTrue(first.isAnswered());
        assertEquals(Long.valueOf(2L), first.getAnswerMessageId());
        assertEquals(45.0, first.getResponseTimeMinutes(), 0.0001);
        assertEquals(T0, first.getAskedAt());

        QuestionAnalysis second = result.getQuestions().get(1);
        assertFalse(second.isAnswered());
        assertNull(second.getResponseTimeMinutes());
        assertEquals(QuestionCategory.BUSINESS, second.getCategory());

        assertEquals(1, result.getAnswers().size());
        assertEquals(1, result.getSummary().getAnswered());
        assertEquals(1, result.getSummary().getUnanswered());
        assertEquals(45.0, result.getSummary().getAvgResponseTimeMinutes(), 0.0001);
    }

    @Test
    void stripsMarkdownFence() {
        AnalysisResult result = parser.parse("```json\n" + VALID + "\n```", window);

        assertEquals(2, result.getSummary().getTotalQuestions());
    }

    @Test
    void stripsSurroundingProse() {
        AnalysisResult result = parser.parse("Here is the analysis:\n" + VALID + "\nHope this helps.", window);

        assertEquals(2, result.getSummary().getTotalQuestions());
    }

    @Test
    void responseTimeIsRecomputedFromTimestamps() {
        String json = VALID.replace("\"response_time_minutes\": 45", "\"response_time_minutes\": 3");

        AnalysisResult result = parser.parse(json, window);

        assertEquals(45.0, result.getQuestions().get(0).getResponseTimeMinutes(), 0.0001);
    }

    @Test
    void earliestQualifyingAnswerWins() {
        String json = """
                {
                  "questions": [
                    {"message_id": 1, "category": "technical", "is_answered": true, "answer_message_id": 3}
                  ],
                  "answers": [
                    {"message_id": 2, "answers_to_message_id": 1},
                    {"message_id": 3, "answers_to_message_id": 1}
                  ]
                }
                """;

        AnalysisResult result = parser.parse(json, window);

        assertEquals(Long.valueOf(2L), result.getQuestions().get(0).getAnswerMessageId());
        assertEquals(45.0, result.getQuestions().get(0).getResponseTimeMinutes(), 0.0001);
        assertEquals("How do I configure the webhook?", result.getQuestions().get(0).getText());
    }

    @Test
    void answerSentBeforeItsQuestionIsDropped() {
        String json = """
                {
                  "questions": [
                    {"message_id": 3, "category": "other", "is_answered": true}
                  ],
                  "answers": [
                    {"message_id": 2, "answers_to_message_id": 3},
                    {"message_id": 4, "answers_to_message_id": 3}
                  ]
                }
                """;

        AnalysisResult result = parser.parse(json, window);

        assertEquals(Long.valueOf(4L), result.getQuestions().get(0).getAnswerMessageId());
        assertEquals(List.of(4L), result.getAnswers().stream().map(AnswerAnalysis::getMessageId).toList());
    }

    @Test
    void emptyQuestionListIsValid() {
        AnalysisResult result = parser.parse("{\"questions\": [], \"answers\": []}", window);

        assertTrue(result.getQuestions().isEmpty());
        assertEquals(0, result.getSummary().getTotalQuestions());
        assertNull(result.getSummary().getAvgResponseTimeMinutes());
    }

    // ===== Rejections =====

    @Test
    void rejectsEmptyResponse() {
        assertMalformed("   ");
    }

    @Test
    void rejectsNonJson() {
        assertMalformed("I could not analyze these messages.");
    }

    @Test
    void rejectsMissingQuestions() {
        assertMalformed("{\"answers\": []}");
    }

    @Test
    void rejectsQuestionOutsideWindow() {
        assertMalformed("""
                {"questions": [{"message_id": 99, "category": "other", "is_answered": false}]}
                """);
    }

    @Test
    void rejectsDuplicateQuestion() {
        assertMalformed("""
                {"questions": [
                  {"message_id": 4, "category": "other", "is_answered": false},
                  {"message_id": 4, "category": "other", "is_answered": false}
                ]}
                """);
    }

    @Test
    void rejectsUnknownCategory() {
        assertMalformed("""
                {"questions": [{"message_id": 4, "category": "finance", "is_answered": false}]}
                """);
    }

    @Test
    void rejectsNonBooleanAnsweredFlag() {
        assertMalformed("""
                {"questions": [{"message_id": 4, "category": "other", "is_answered": "no"}]}
                """);
    }

    @Test
    void rejectsNegativeResponseTime() {
        assertMalformed("""
                {"questions": [{"message_id": 1, "category": "technical", "is_answered": true,
                  "answer_message_id": 2, "response_time_minutes": -4}]}
                """);
    }

    @Test
    void rejectsUnansweredQuestionWithAnswerId() {
        assertMalformed("""
                {"questions": [{"message_id": 1, "category": "technical", "is_answered": false,
                  "answer_message_id": 2}]}
                """);
    }

    @Test
    void rejectsAnswerIdOutsideWindow() {
        assertMalformed("""
                {"questions": [{"message_id": 1, "category": "technical", "is_answered": true,
                  "answer_message_id": 77}]}
                """);
    }

    @Test
    void rejectsAnswerReferencingUnknownQuestion() {
        assertMalformed("""
                {"questions": [],
                 "answers": [{"message_id": 2, "answers_to_message_id": 1}]}
                """);
    }

    @Test
    void rejectsAnswerReferencingUnansweredQuestion() {
        assertMalformed("""
                {"questions": [{"message_id": 1, "category": "technical", "is_answered": false}],
                 "answers": [{"message_id": 2, "answers_to_message_id": 1}]}
                """);
    }

    @Test
    void rejectsAnsweredQuestionWithoutLaterAnswer() {
        assertMalformed("""
                {"questions": [{"message_id": 4, "category": "business", "is_answered": true,
                  "answer_message_id": 2}]}
                """);
    }

    @Test
    void rejectsSummaryCountMismatch() {
        assertMalformed(VALID.replace("\"total_questions\": 2", "\"total_questions\": 5"));
    }

    private void assertMalformed(String raw) {
        assertThrows(MalformedAnalysisResponseException.class, () -> parser.parse(raw, window));
    }

    private static Message message(long id, Instant sentAt, String text) {
        return Message.builder()
                .chatId(CHAT_ID)
                .messageId(id)
                .senderId(500 + id)
                .senderName("Sender" + id)
                .text(text)
                .sentAt(sentAt)
                .build();
    }
}
