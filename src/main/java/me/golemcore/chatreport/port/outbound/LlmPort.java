package me.golemcore.chatreport.port.outbound;

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
import me.golemcore.chatreport.domain.model.LlmResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the LLM provider that analyzes chat windows (Anthropic or any
 * OpenAI-compatible endpoint).
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Executes a completion request. The future fails with the provider's own
     * exception; callers classify it.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the model identifier used by this provider.
     */
    String getCurrentModel();

    /**
     * Checks if the provider is configured.
     */
    boolean isAvailable();
}
