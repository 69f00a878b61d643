package me.misix.bot.domain.service;

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

import me.misix.bot.domain.model.exception.DuplicateUpdateException;
import me.misix.bot.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Process-local set of recently accepted update ids, LRU-evicted at
 * {@code bot.pipeline.dedup-window} entries.
 */
@Component
public class UpdateDeduplicator {

    private final Map<Long, Boolean> seen;

    public UpdateDeduplicator(BotProperties properties) {
        int capacity = Math.max(1, properties.getPipeline().getDedupWindow());
        this.seen = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Records the update id.
     *
     * @throws DuplicateUpdateException
     *             when the id is still inside the retention window
     */
    public void register(long updateId) {
        synchronized (seen) {
            if (seen.containsKey(updateId)) {
                seen.get(updateId); // refresh recency
                throw new DuplicateUpdateException(updateId);
            }
            seen.put(updateId, Boolean.TRUE);
        }
    }
}
