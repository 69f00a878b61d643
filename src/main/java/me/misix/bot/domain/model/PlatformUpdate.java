package me.misix.bot.domain.model;

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

/**
 * Raw update envelope as delivered by the platform. Every update advances the
 * polling offset, but only those carrying a user message have a
 * {@code message}.
 */
public record PlatformUpdate(long updateId, InboundUpdate message) {

    public static PlatformUpdate ignored(long updateId) {
        return new PlatformUpdate(updateId, null);
    }

    public boolean hasMessage() {
        return message != null;
    }
}
