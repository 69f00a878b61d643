package me.misix.bot.port.inbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Outbound reply channel of a chat platform.
 *
 * <p>
 * Failures complete the future exceptionally with a
 * {@link me.misix.bot.domain.model.exception.TransientNetworkException} when a
 * later attempt may succeed.
 */
public interface ChannelPort {

    /**
     * Channel identifier, e.g. {@code telegram}.
     */
    String getChannelType();

    CompletableFuture<Void> sendMessage(String chatId, String text);
}
