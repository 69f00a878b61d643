package me.misix.bot.domain.extraction;

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
import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.IntentKind;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Routes an intent kind to its extractor. The dispatch table is built from
 * every {@link EntityExtractor} bean by its {@link EntityExtractor#supportedKinds()}.
 * {@link IntentKind#GENERAL_CHAT} has no extractor and never yields a draft.
 */
@Service
@Slf4j
public class ExtractionEngine {

    private final Map<IntentKind, EntityExtractor> extractors;

    public ExtractionEngine(List<EntityExtractor> extractors) {
        Map<IntentKind, EntityExtractor> table = new EnumMap<>(IntentKind.class);
        for (EntityExtractor extractor : extractors) {
            for (IntentKind kind : extractor.supportedKinds()) {
                EntityExtractor previous = table.put(kind, extractor);
                if (previous != null) {
                    throw new IllegalStateException("Two extractors registered for " + kind + ": "
                            + previous.getClass().getSimpleName() + ", " + extractor.getClass().getSimpleName());
                }
            }
        }
        this.extractors = Collections.unmodifiableMap(table);
        log.info("[Extraction] registered extractors for {}", table.keySet());
    }

    public boolean supports(IntentKind kind) {
        return kind != null && extractors.containsKey(kind);
    }

    /**
     * Starts extraction of {@code kind} from {@code text}; {@code context} is the
     * recent conversation, oldest first, used to resolve references such as
     * "то же самое" or "его". The future never completes exceptionally.
     */
    public CompletableFuture<Optional<EntityDraft>> extract(IntentKind kind, String text,
            List<ConversationTurn> context) {
        if (!supports(kind)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return extractors.get(kind).extract(kind, text, context != null ? context : List.of());
    }
}
