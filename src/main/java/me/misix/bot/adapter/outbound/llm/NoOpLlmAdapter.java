package me.misix.bot.adapter.outbound.llm;

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
import me.misix.bot.domain.model.LlmRequest;
import me.misix.bot.domain.model.LlmResponse;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no LLM provider is configured.
 *
 * <p>
 * Reports itself as unavailable, so callers take their keyword and apology
 * fallbacks instead of relying on its placeholder reply.
 *
 * <p>
 * Provider ID: {@code "none"}
 *
 * @see LlmProviderAdapter
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "none";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content("[No LLM configured]")
                .model(PROVIDER_ID)
                .finishReason("stop")
                .build());
    }

    @Override
    public String getCurrentModel() {
        return PROVIDER_ID;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
