package me.golemcore.chatreport.adapter.outbound.llm;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.chatreport.domain.exception.AnalysisAuthenticationException;
import me.golemcore.chatreport.domain.model.LlmRequest;
import me.golemcore.chatreport.domain.model.LlmResponse;
import me.golemcore.chatreport.infrastructure.config.BotProperties;
import me.golemcore.chatreport.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter backed by langchain4j.
 *
 * <p>
 * {@code bot.llm.provider=anthropic} uses the Anthropic Messages API, every
 * other value an OpenAI-compatible endpoint (optionally at
 * {@code bot.llm.base-url}). Client-side retries are disabled; the analysis
 * service owns the retry loop. Failures are translated by
 * {@link LlmErrorClassifier}.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String PROVIDER_ANTHROPIC = "anthropic";

    private final BotProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized;

    public Langchain4jAdapter(BotProperties properties) {
        this.properties = properties;
    }

    Langchain4jAdapter(BotProperties properties, ChatModel chatModel) {
        this.properties = properties;
        this.chatModel = chatModel;
        this.initialized = true;
    }

    private synchronized void initialize() {
        if (initialized) {
            return;
        }
        BotProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            throw new AnalysisAuthenticationException("LLM API key not configured. Set bot.llm.api-key or LLM_API_KEY",
                    null);
        }
        this.chatModel = PROVIDER_ANTHROPIC.equals(normalizedProvider())
                ? createAnthropicModel(llm)
                : createOpenAiModel(llm);
        initialized = true;
        log.info("[LLM] Initialized provider {} with model {}", normalizedProvider(), llm.getModel());
    }

    private ChatModel createAnthropicModel(BotProperties.LlmProperties llm) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(BotProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return normalizedProvider();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            List<ChatMessage> messages = new ArrayList<>();
            if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
                messages.add(SystemMessage.from(request.getSystemPrompt()));
            }
            messages.add(UserMessage.from(request.getUserPrompt()));

            try {
                ChatResponse response = chatModel.chat(messages);
                return convertResponse(response);
            } catch (RuntimeException e) {
                log.debug("[LLM] Call failed: {}", e.getMessage());
                throw LlmErrorClassifier.classify(e);
            }
        });
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(properties.getLlm().getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private String normalizedProvider() {
        String provider = properties.getLlm().getProvider();
        return provider != null ? provider.trim().toLowerCase(Locale.ROOT) : PROVIDER_ANTHROPIC;
    }
}
