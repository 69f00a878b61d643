package me.misix.bot.adapter.outbound.persistence;

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

import java.util.regex.Pattern;

/**
 * Turns external identifiers into single, traversal-free path segments.
 */
final class StoragePaths {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_-]");

    private StoragePaths() {
    }

    static String safeSegment(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Storage id must not be blank");
        }
        return UNSAFE.matcher(id).replaceAll("_");
    }
}
