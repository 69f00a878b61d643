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
 * Outcome of one persistence attempt. A single update may carry several
 * results, some persisted and some failed.
 */
public record EntityResult(IntentKind kind, PersistedEntity entity, FailureKind failure, String error) {

    public static EntityResult persisted(PersistedEntity entity) {
        return new EntityResult(entity.kind(), entity, null, null);
    }

    public static EntityResult failed(IntentKind kind, FailureKind failure, String error) {
        return new EntityResult(kind, null, failure, error);
    }

    public boolean isPersisted() {
        return entity != null;
    }
}
