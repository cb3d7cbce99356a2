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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.exception.AnalysisException;
import me.golemcore.chatreport.domain.exception.AnalysisRateLimitedException;
import me.golemcore.chatreport.domain.exception.AnalysisTransientException;
import me.golemcore.chatreport.domain.model.AnalysisResult;
import me.golemcore.chatreport.domain.model.LlmRequest;
import me.golemcore.chatreport.domain.model.LlmResponse;
import me.golemcore.chatreport.domain.model.Message;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import me.golemcore.chatreport.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends one chat window to the LLM provider and returns the validated
 * analysis.
 *
 * <p>
 * Rate-limited and transient failures are retried with exponential backoff up
 * to {@code bot.llm.max-attempts}. Authentication failures and malformed
 * replies are raised immediately.
 */
@Service
@Slf4j
public class AnalysisClient {

    private final LlmPort llmPort;
    private final AnalysisPromptBuilder promptBuilder;
    private final AnalysisResponseParser responseParser;
    private final BotProperties properties;
    private final Sleeper sleeper;

    public AnalysisClient(LlmPort llmPort, AnalysisPromptBuilder promptBuilder,
            AnalysisResponseParser responseParser, BotProperties properties, Sleeper sleeper) {
        this.llmPort = llmPort;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public AnalysisResult analyze(List<Message> messages) {
        if (messages.isEmpty()) {
            return AnalysisResult.builder().build();
        }

        BotProperties.LlmProperties llm = properties.getLlm();
        RetryPolicy retryPolicy = RetryPolicy.of(llm.getMaxAttempts(), llm.getInitialBackoff(), llm.getMaxBackoff());
        LlmRequest request = promptBuilder.build(messages, llm.getMaxTokens(), llm.getTemperature());

        for (int attempt = 1;; attempt++) {
            try {
                LlmResponse response = call(request, llm.getTimeout());
                AnalysisResult result = responseParser.parse(response.getContent(), messages);
                log.info("[Analysis] {} messages: {} questions, {} answered, {} unanswered",
                        messages.size(), result.getSummary().getTotalQuestions(),
                        result.getSummary().getAnswered(), result.getSummary().getUnanswered());
                return result;
            } catch (AnalysisException e) {
                if (!e.isRetryable() || !retryPolicy.canRetry(attempt) || Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                Duration hint = e instanceof AnalysisRateLimitedException rateLimited
                        ? rateLimited.getRetryAfter().orElse(null)
                        : null;
                Duration delay = retryPolicy.delayForAttempt(attempt, hint);
                log.warn("[Analysis] Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt, retryPolicy.maxAttempts(), e.getMessage(), delay.toMillis());
                backoff(delay);
            }
        }
    }

    private LlmResponse call(LlmRequest request, Duration timeout) {
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        try {
            LlmResponse response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response == null) {
                throw new AnalysisTransientException("Provider returned no response", null);
            }
            return response;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AnalysisTransientException("Analysis timed out after " + timeout.toSeconds() + "s", e, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AnalysisException analysisException) {
                throw analysisException;
            }
            throw new AnalysisTransientException("Analysis call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AnalysisTransientException("Analysis interrupted", e);
        }
    }

    private void backoff(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisTransientException("Analysis interrupted during retry backoff", e);
        }
    }
}
