package me.golemcore.chatreport.domain.service;

import me.golemcore.chatreport.domain.exception.AnalysisAuthenticationException;
import me.golemcore.chatreport.domain.exception.AnalysisException;
import me.golemcore.chatreport.domain.exception.AnalysisRateLimitedException;
import me.golemcore.chatreport.domain.exception.AnalysisTransientException;
import me.golemcore.chatreport.domain.exception.MalformedAnalysisResponseException;
import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.LlmRequest;
import me.golemcore.chatreport.domain.model.LlmResponse;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.infrastructure.config.AutoConfiguration;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import me.golemcore.chatreport.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AnalysisClientTest {

    private static final String VALID_RESPONSE = """
            {"questions": [{"message_id": 1, "text": "Is the API up?", "category": "technical",
              "is_answered": true, "answer_message_id": 2, "response_time_minutes": 10}],
             "answers": [{"message_id": 2, "text": "Yes", "answers_to_message_id": 1}],
             "summary": {"total_questions": 1, "answered": 1, "unanswered": 0, "avg_response_time_minutes": 10}}
            """;

    private LlmPort llmPort;
    private BotProperties properties;
    private List<Duration> sleeps;
    private AnalysisClient client;

    private final List<Message> window = List.of(
            Message.builder().chatId(-1).messageId(1).senderId(10).text("Is the API up?")
                    .sentAt(Instant.parse("2025-01-15T08:00:00Z")).build(),
            Message.builder().chatId(-1).messageId(2).senderId(11).text("Yes")
                    .sentAt(Instant.parse("2025-01-15T08:10:00Z")).build());

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new BotProperties();
        properties.getLlm().setMaxAttempts(3);
        properties.getLlm().setInitialBackoff(Duration.ofSeconds(5));
        properties.getLlm().setMaxBackoff(Duration.ofSeconds(60));
        properties.getLlm().setTimeout(Duration.ofSeconds(2));
        sleeps = new ArrayList<>();
        client = new AnalysisClient(llmPort, new AnalysisPromptBuilder(),
                new AnalysisResponseParser(AutoConfiguration.objectMapper()), properties, sleeps::add);
    }

    @Test
    void emptyWindowSkipsProvider() {
        AnalysisResult result = client.analyze(List.of());

        assertEquals(0, result.getSummary().getTotalQuestions());
        verifyNoInteractions(llmPort);
    }

    @Test
    void successfulAnalysis() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(ok(VALID_RESPONSE));

        AnalysisResult result = client.analyze(window);

        assertEquals(1, result.getSummary().getAnswered());
        assertEquals(10.0, result.getQuestions().get(0).getResponseTimeMinutes(), 0.0001);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void transientFailureIsRetriedWithBackoff() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(failed(new AnalysisTransientException("502 from provider", null)))
                .thenReturn(ok(VALID_RESPONSE));

        AnalysisResult result = client.analyze(window);

        assertEquals(1, result.getSummary().getTotalQuestions());
        assertEquals(List.of(Duration.ofSeconds(5)), sleeps);
        verify(llmPort, times(2)).chat(any(LlmRequest.class));
    }

    @Test
    void rateLimitHintExtendsBackoff() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(failed(new AnalysisRateLimitedException("429", Duration.ofSeconds(20), null)))
                .thenReturn(ok(VALID_RESPONSE));

        client.analyze(window);

        assertEquals(List.of(Duration.ofSeconds(20)), sleeps);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenAnswer(inv -> failed(new AnalysisTransientException("overloaded", null)));

        assertThrows(AnalysisTransientException.class, () -> client.analyze(window));

        verify(llmPort, times(3)).chat(any(LlmRequest.class));
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(10)), sleeps);
    }

    @Test
    void malformedResponseIsNotRetried() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(ok("not json at all"));

        assertThrows(MalformedAnalysisResponseException.class, () -> client.analyze(window));

        verify(llmPort, times(1)).chat(any(LlmRequest.class));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void authenticationFailureIsNotRetried() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(failed(new AnalysisAuthenticationException("401", null)));

        assertThrows(AnalysisAuthenticationException.class, () -> client.analyze(window));

        verify(llmPort, times(1)).chat(any(LlmRequest.class));
    }

    @Test
    void rejectedRequestIsNotRetried() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(failed(new AnalysisException("invalid request")));

        AnalysisException ex = assertThrows(AnalysisException.class, () -> client.analyze(window));

        assertFalse(ex.isRetryable());
        verify(llmPort, times(1)).chat(any(LlmRequest.class));
    }

    @Test
    void unresponsiveProviderTimesOut() {
        properties.getLlm().setMaxAttempts(1);
        properties.getLlm().setTimeout(Duration.ofMillis(50));
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(new CompletableFuture<>());

        AnalysisTransientException ex = assertThrows(AnalysisTransientException.class,
                () -> client.analyze(window));

        assertTrue(ex.isTimeout());
    }

    @Test
    void unexpectedProviderErrorIsTreatedAsTransient() {
        properties.getLlm().setMaxAttempts(1);
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(failed(new IllegalStateException("boom")));

        assertThrows(AnalysisTransientException.class, () -> client.analyze(window));
    }

    private static CompletableFuture<LlmResponse> ok(String content) {
        return CompletableFuture.completedFuture(LlmResponse.builder().content(content).model("test").build());
    }

    private static CompletableFuture<LlmResponse> failed(Throwable error) {
        return CompletableFuture.failedFuture(error);
    }
}
