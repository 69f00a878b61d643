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

import me.misix.bot.domain.model.ConversationTurn;
import me.misix.bot.domain.model.EntityDraft;
import me.misix.bot.domain.model.IntentKind;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Turns free text into a validated entity draft for one or more intent kinds.
 *
 * <p>
 * The returned future never completes exceptionally: low confidence,
 * unparseable output, timeouts and provider errors all complete it with an
 * empty optional.
 */
public interface EntityExtractor {

    Set<IntentKind> supportedKinds();

    /**
     * @param context
     *            recent conversation turns, oldest first, possibly empty
     */
    CompletableFuture<Optional<EntityDraft>> extract(IntentKind kind, String text, List<ConversationTurn> context);
}
